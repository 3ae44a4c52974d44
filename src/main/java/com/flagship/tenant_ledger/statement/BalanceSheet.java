package com.flagship.tenant_ledger.statement;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Assets = Liabilities + Equity, where equity includes the current earnings
 * (cumulative revenue minus expenses) not yet closed to retained earnings.
 */
@Value
public class BalanceSheet {
    LocalDate asOf;
    List<StatementLine> assets;
    List<StatementLine> liabilities;
    List<StatementLine> equity;
    long currentEarnings;
    long totalAssets;
    long totalLiabilities;
    long totalEquity;

    public long getTotalLiabilitiesAndEquity() {
        return totalLiabilities + totalEquity;
    }
}
