package com.flagship.tenant_ledger.ledger;

/**
 * The two sides of a double-entry posting. Also used as the normal-balance
 * side of an account type.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
