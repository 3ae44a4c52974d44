package com.flagship.tenant_ledger.reconciliation;

public enum ReconciliationStatus {
    MATCHED,
    DISCREPANCY
}
