package com.flagship.tenant_ledger.reconciliation;

import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class ReconciliationResult {
    UUID batchId;
    ReconciliationStatus status;
    List<UUID> matchedEntries;
    long matchedTotal;
    /** Statement balance minus book balance; zero when matched. */
    long discrepancy;

    public boolean isMatched() {
        return status == ReconciliationStatus.MATCHED;
    }
}
