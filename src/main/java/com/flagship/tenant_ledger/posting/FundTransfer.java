package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FundTransfer {
    @NonNull
    String transferId;
    @NonNull
    LocalDate transferDate;
    @NonNull
    UUID sourceAccountId;
    @NonNull
    UUID destinationAccountId;
    long amount;
    String note;
}
