package com.flagship.tenant_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A recorded reconciliation attempt. Matched entries point at their batch;
 * a discrepancy batch has no entries attached.
 */
@Value
public class ReconciliationBatch {
    UUID id;
    UUID tenantId;
    UUID accountId;
    LocalDate statementDate;
    long closingBalance;
    long matchedTotal;
    long discrepancy;
    int entryCount;
    ReconciliationStatus status;
    Instant createdAt;
}
