package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class ReconcileRequest {

    @NotNull(message = "Statement date is required")
    @JsonProperty("statement_date")
    LocalDate statementDate;

    @NotNull(message = "Closing balance is required")
    @JsonProperty("closing_balance")
    BigDecimal closingBalance;
}
