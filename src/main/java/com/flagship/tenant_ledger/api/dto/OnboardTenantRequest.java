package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OnboardTenantRequest {

    @NotBlank(message = "Identifier is required")
    @JsonProperty("identifier")
    String identifier;

    @NotBlank(message = "Business name is required")
    @JsonProperty("business_name")
    String businessName;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("base_currency")
    String baseCurrency;

    @Min(value = 1, message = "Fiscal year start month must be 1-12")
    @Max(value = 12, message = "Fiscal year start month must be 1-12")
    @JsonProperty("fiscal_year_start_month")
    Integer fiscalYearStartMonth;
}
