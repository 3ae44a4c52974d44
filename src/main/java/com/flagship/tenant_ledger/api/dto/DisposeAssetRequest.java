package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class DisposeAssetRequest {

    @NotNull(message = "Disposal date is required")
    @JsonProperty("disposal_date")
    LocalDate disposalDate;

    @NotNull(message = "Proceeds are required")
    @PositiveOrZero(message = "Proceeds must not be negative")
    @JsonProperty("proceeds")
    BigDecimal proceeds;

    @JsonProperty("proceeds_account_id")
    UUID proceedsAccountId;
}
