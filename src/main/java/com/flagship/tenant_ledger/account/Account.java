package com.flagship.tenant_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * An account in one tenant's chart of accounts.
 * Balances are never stored here; they are derived from ledger entries.
 */
@Value
public class Account {
    UUID id;
    UUID tenantId;
    String code;
    String name;
    AccountType type;
    SystemAccount systemRole; // null for user-created accounts
    boolean active;

    public boolean isSystem() {
        return systemRole != null;
    }
}
