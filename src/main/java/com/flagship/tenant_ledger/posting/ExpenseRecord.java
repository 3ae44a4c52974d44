package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class ExpenseRecord {
    @NonNull
    String expenseId;
    @NonNull
    LocalDate expenseDate;
    @NonNull
    UUID expenseAccountId;
    UUID paymentAccountId; // defaults to Cash
    long amount;
    String description;
}
