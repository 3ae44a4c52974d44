package com.flagship.tenant_ledger.account;

import com.flagship.tenant_ledger.ledger.EntryType;

/**
 * The closed five-type account taxonomy.
 *
 * Each type has a normal balance side: assets and expenses grow with debits,
 * liabilities, equity and revenue grow with credits.
 */
public enum AccountType {
    ASSET(EntryType.DEBIT),
    LIABILITY(EntryType.CREDIT),
    EQUITY(EntryType.CREDIT),
    REVENUE(EntryType.CREDIT),
    EXPENSE(EntryType.DEBIT);

    private final EntryType normalBalance;

    AccountType(EntryType normalBalance) {
        this.normalBalance = normalBalance;
    }

    public EntryType getNormalBalance() {
        return normalBalance;
    }

    /**
     * Balance in this type's normal-balance sign: positive when the account
     * holds a balance on its normal side.
     */
    public long signedBalance(long totalDebit, long totalCredit) {
        return normalBalance == EntryType.DEBIT
            ? Math.subtractExact(totalDebit, totalCredit)
            : Math.subtractExact(totalCredit, totalDebit);
    }
}
