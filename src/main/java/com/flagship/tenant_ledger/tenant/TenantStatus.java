package com.flagship.tenant_ledger.tenant;

public enum TenantStatus {
    TRIAL,
    ACTIVE,
    SUSPENDED;

    public boolean canTransact() {
        return this != SUSPENDED;
    }
}
