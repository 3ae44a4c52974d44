package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.statement.TrialBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TrialBalanceResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    public static TrialBalanceResponse from(TrialBalance trialBalance) {
        return TrialBalanceResponse.builder()
            .asOf(trialBalance.getAsOf())
            .lines(trialBalance.getLines().stream()
                .map(line -> new Line(line.getAccountId(), line.getCode(), line.getName(), line.getType(),
                    Money.toDecimal(line.getDebit()), Money.toDecimal(line.getCredit())))
                .toList())
            .totalDebit(Money.toDecimal(trialBalance.getTotalDebit()))
            .totalCredit(Money.toDecimal(trialBalance.getTotalCredit()))
            .build();
    }

    @Value
    public static class Line {
        @JsonProperty("account_id")
        UUID accountId;
        @JsonProperty("code")
        String code;
        @JsonProperty("name")
        String name;
        @JsonProperty("type")
        AccountType type;
        @JsonProperty("debit")
        BigDecimal debit;
        @JsonProperty("credit")
        BigDecimal credit;
    }
}
