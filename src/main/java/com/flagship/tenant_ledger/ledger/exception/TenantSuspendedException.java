package com.flagship.tenant_ledger.ledger.exception;

public class TenantSuspendedException extends LedgerException {

    public TenantSuspendedException(String identifier) {
        super("TENANT_SUSPENDED", "Tenant is suspended: " + identifier);
    }
}
