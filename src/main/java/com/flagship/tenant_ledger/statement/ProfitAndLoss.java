package com.flagship.tenant_ledger.statement;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class ProfitAndLoss {
    LocalDate from;
    LocalDate to;
    List<StatementLine> revenue;
    List<StatementLine> expenses;
    long totalRevenue;
    long totalExpenses;
    long costOfSales;
    long grossProfit;
    long netIncome;
}
