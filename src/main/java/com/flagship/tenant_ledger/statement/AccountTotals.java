package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.SystemAccount;
import lombok.Value;

import java.util.UUID;

/**
 * Summed debits and credits of one account over some date window.
 */
@Value
public class AccountTotals {
    UUID accountId;
    String code;
    String name;
    AccountType type;
    SystemAccount systemRole;
    long totalDebit;
    long totalCredit;

    /**
     * Balance in the account type's normal-balance sign.
     */
    public long getBalance() {
        return type.signedBalance(totalDebit, totalCredit);
    }

    public long getNetDebit() {
        return Math.subtractExact(totalDebit, totalCredit);
    }
}
