package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.statement.BalanceSheet;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class BalanceSheetResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("assets")
    List<StatementLineResponse> assets;

    @JsonProperty("liabilities")
    List<StatementLineResponse> liabilities;

    @JsonProperty("equity")
    List<StatementLineResponse> equity;

    @JsonProperty("current_earnings")
    BigDecimal currentEarnings;

    @JsonProperty("total_assets")
    BigDecimal totalAssets;

    @JsonProperty("total_liabilities")
    BigDecimal totalLiabilities;

    @JsonProperty("total_equity")
    BigDecimal totalEquity;

    public static BalanceSheetResponse from(BalanceSheet sheet) {
        return BalanceSheetResponse.builder()
            .asOf(sheet.getAsOf())
            .assets(sheet.getAssets().stream().map(StatementLineResponse::from).toList())
            .liabilities(sheet.getLiabilities().stream().map(StatementLineResponse::from).toList())
            .equity(sheet.getEquity().stream().map(StatementLineResponse::from).toList())
            .currentEarnings(Money.toDecimal(sheet.getCurrentEarnings()))
            .totalAssets(Money.toDecimal(sheet.getTotalAssets()))
            .totalLiabilities(Money.toDecimal(sheet.getTotalLiabilities()))
            .totalEquity(Money.toDecimal(sheet.getTotalEquity()))
            .build();
    }
}
