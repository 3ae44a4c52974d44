package com.flagship.tenant_ledger.ledger.exception;

public class TenantNotFoundException extends LedgerException {

    public TenantNotFoundException(String identifier) {
        super("TENANT_NOT_FOUND", "Tenant not found: " + identifier);
    }
}
