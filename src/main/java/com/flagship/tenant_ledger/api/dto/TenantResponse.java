package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TenantResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("identifier")
    String identifier;

    @JsonProperty("business_name")
    String businessName;

    @JsonProperty("status")
    TenantStatus status;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("fiscal_year_start_month")
    int fiscalYearStartMonth;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TenantResponse from(Tenant tenant) {
        return TenantResponse.builder()
            .id(tenant.getId())
            .identifier(tenant.getIdentifier())
            .businessName(tenant.getBusinessName())
            .status(tenant.getStatus())
            .baseCurrency(tenant.getBaseCurrency().name())
            .fiscalYearStartMonth(tenant.getFiscalYearStartMonth())
            .createdAt(tenant.getCreatedAt())
            .build();
    }
}
