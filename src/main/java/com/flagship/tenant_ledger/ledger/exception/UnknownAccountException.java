package com.flagship.tenant_ledger.ledger.exception;

import java.util.UUID;

/**
 * The account does not exist in the caller's tenant, or it is inactive.
 * An account id that belongs to another tenant is reported the same way as a missing one.
 */
public class UnknownAccountException extends PostingRejectedException {

    private final UUID accountId;

    public UnknownAccountException(UUID accountId) {
        super("UNKNOWN_ACCOUNT", "Account not found or inactive: " + accountId);
        this.accountId = accountId;
    }

    public UUID getAccountId() {
        return accountId;
    }
}
