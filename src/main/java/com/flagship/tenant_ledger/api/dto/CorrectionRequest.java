package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A corrective posting after a reconciliation discrepancy. A positive amount
 * raises the reconciled account's balance, a negative one lowers it.
 */
@Value
@Builder
@Jacksonized
public class CorrectionRequest {

    @NotNull(message = "Offset account ID is required")
    @JsonProperty("offset_account_id")
    UUID offsetAccountId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Transaction date is required")
    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("note")
    String note;
}
