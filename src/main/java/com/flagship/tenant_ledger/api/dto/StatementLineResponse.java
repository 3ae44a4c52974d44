package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.statement.StatementLine;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class StatementLineResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("amount")
    BigDecimal amount;

    public static StatementLineResponse from(StatementLine line) {
        return new StatementLineResponse(line.getAccountId(), line.getCode(), line.getName(),
            Money.toDecimal(line.getAmount()));
    }
}
