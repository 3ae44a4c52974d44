package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.statement.ProfitAndLoss;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ProfitAndLossResponse {

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("revenue")
    List<StatementLineResponse> revenue;

    @JsonProperty("expenses")
    List<StatementLineResponse> expenses;

    @JsonProperty("total_revenue")
    BigDecimal totalRevenue;

    @JsonProperty("total_expenses")
    BigDecimal totalExpenses;

    @JsonProperty("cost_of_sales")
    BigDecimal costOfSales;

    @JsonProperty("gross_profit")
    BigDecimal grossProfit;

    @JsonProperty("net_income")
    BigDecimal netIncome;

    public static ProfitAndLossResponse from(ProfitAndLoss statement) {
        return ProfitAndLossResponse.builder()
            .from(statement.getFrom())
            .to(statement.getTo())
            .revenue(statement.getRevenue().stream().map(StatementLineResponse::from).toList())
            .expenses(statement.getExpenses().stream().map(StatementLineResponse::from).toList())
            .totalRevenue(Money.toDecimal(statement.getTotalRevenue()))
            .totalExpenses(Money.toDecimal(statement.getTotalExpenses()))
            .costOfSales(Money.toDecimal(statement.getCostOfSales()))
            .grossProfit(Money.toDecimal(statement.getGrossProfit()))
            .netIncome(Money.toDecimal(statement.getNetIncome()))
            .build();
    }
}
