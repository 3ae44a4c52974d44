package com.flagship.tenant_ledger.ledger.exception;

import java.util.UUID;

public class AccountInUseException extends LedgerException {

    private final UUID accountId;

    public AccountInUseException(UUID accountId, String reason) {
        super("ACCOUNT_IN_USE", "Account " + accountId + " cannot be changed: " + reason);
        this.accountId = accountId;
    }

    public UUID getAccountId() {
        return accountId;
    }
}
