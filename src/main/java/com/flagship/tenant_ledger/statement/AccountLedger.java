package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.Account;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Entry-by-entry history of one account with a running balance in the
 * account's normal-balance sign.
 */
@Value
public class AccountLedger {
    Account account;
    LocalDate from;
    LocalDate to;
    long openingBalance;
    List<Line> lines;
    long closingBalance;

    @Value
    public static class Line {
        UUID entryId;
        String voucherNumber;
        LocalDate transactionDate;
        String description;
        long debit;
        long credit;
        boolean reconciled;
        long runningBalance;

        Line withRunningBalance(long balance) {
            return new Line(entryId, voucherNumber, transactionDate, description, debit, credit, reconciled, balance);
        }
    }
}
