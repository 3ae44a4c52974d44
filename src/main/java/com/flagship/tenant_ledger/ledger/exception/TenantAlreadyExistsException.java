package com.flagship.tenant_ledger.ledger.exception;

public class TenantAlreadyExistsException extends LedgerException {

    public TenantAlreadyExistsException(String identifier) {
        super("TENANT_EXISTS", "Tenant identifier already taken: " + identifier);
    }
}
