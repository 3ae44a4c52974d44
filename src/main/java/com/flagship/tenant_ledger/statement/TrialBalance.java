package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.AccountType;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class TrialBalance {
    LocalDate asOf;
    List<Line> lines;
    long totalDebit;
    long totalCredit;

    public boolean isBalanced() {
        return totalDebit == totalCredit;
    }

    /**
     * One account's net balance, shown in the debit or the credit column.
     */
    @Value
    public static class Line {
        UUID accountId;
        String code;
        String name;
        AccountType type;
        long debit;
        long credit;
    }
}
