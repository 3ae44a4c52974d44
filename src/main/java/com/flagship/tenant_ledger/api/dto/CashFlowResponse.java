package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.statement.CashFlowStatement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CashFlowResponse {

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("cash_account_ids")
    List<UUID> cashAccountIds;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("activities")
    List<Activity> activities;

    @JsonProperty("total_inflows")
    BigDecimal totalInflows;

    @JsonProperty("total_outflows")
    BigDecimal totalOutflows;

    @JsonProperty("net_change")
    BigDecimal netChange;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @Value
    public static class Activity {

        @JsonProperty("origin")
        OriginModule origin;

        @JsonProperty("inflows")
        BigDecimal inflows;

        @JsonProperty("outflows")
        BigDecimal outflows;

        @JsonProperty("net")
        BigDecimal net;
    }

    public static CashFlowResponse from(CashFlowStatement statement) {
        return CashFlowResponse.builder()
            .from(statement.getFrom())
            .to(statement.getTo())
            .cashAccountIds(statement.getCashAccountIds())
            .openingBalance(Money.toDecimal(statement.getOpeningBalance()))
            .activities(statement.getActivities().stream()
                .map(activity -> new Activity(activity.getOrigin(), Money.toDecimal(activity.getInflows()),
                    Money.toDecimal(activity.getOutflows()), Money.toDecimal(activity.getNet())))
                .toList())
            .totalInflows(Money.toDecimal(statement.getTotalInflows()))
            .totalOutflows(Money.toDecimal(statement.getTotalOutflows()))
            .netChange(Money.toDecimal(statement.getNetChange()))
            .closingBalance(Money.toDecimal(statement.getClosingBalance()))
            .build();
    }
}
