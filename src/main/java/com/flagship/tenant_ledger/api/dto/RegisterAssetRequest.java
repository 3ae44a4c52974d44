package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.depreciation.DepreciationMethod;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class RegisterAssetRequest {

    @JsonProperty("asset_number")
    String assetNumber;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Acquisition date is required")
    @JsonProperty("acquisition_date")
    LocalDate acquisitionDate;

    @NotNull(message = "Cost is required")
    @JsonProperty("cost")
    BigDecimal cost;

    @JsonProperty("salvage_value")
    BigDecimal salvageValue;

    @NotNull(message = "Depreciation method is required")
    @JsonProperty("method")
    DepreciationMethod method;

    @Min(value = 1, message = "Useful life must be at least one month")
    @JsonProperty("useful_life_months")
    int usefulLifeMonths;

    @Min(value = 0, message = "Declining rate must not be negative")
    @Max(value = 10000, message = "Declining rate must be at most 10000 basis points")
    @JsonProperty("declining_rate_bps")
    int decliningRateBps;

    @JsonProperty("expense_account_id")
    UUID expenseAccountId;

    @JsonProperty("accumulated_account_id")
    UUID accumulatedAccountId;
}
