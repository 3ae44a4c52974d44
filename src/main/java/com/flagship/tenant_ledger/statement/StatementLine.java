package com.flagship.tenant_ledger.statement;

import lombok.Value;

import java.util.UUID;

/**
 * An account and its amount on a statement, in the account's normal-balance sign.
 */
@Value
public class StatementLine {
    UUID accountId;
    String code;
    String name;
    long amount;

    static StatementLine of(AccountTotals totals) {
        return new StatementLine(totals.getAccountId(), totals.getCode(), totals.getName(), totals.getBalance());
    }
}
