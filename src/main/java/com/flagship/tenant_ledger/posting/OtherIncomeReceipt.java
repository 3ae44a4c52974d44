package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class OtherIncomeReceipt {
    @NonNull
    String incomeId;
    @NonNull
    LocalDate receivedDate;
    UUID depositAccountId; // defaults to Cash
    UUID incomeAccountId;  // defaults to Other Income
    long amount;
    String description;
}
