package com.flagship.tenant_ledger.ledger.exception;

public class DuplicateAccountException extends LedgerException {

    public DuplicateAccountException(String field, String value) {
        super("DUPLICATE_ACCOUNT", "An account with " + field + " '" + value + "' already exists");
    }
}
