package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.depreciation.AssetStatus;
import com.flagship.tenant_ledger.depreciation.DepreciationMethod;
import com.flagship.tenant_ledger.depreciation.FixedAsset;
import com.flagship.tenant_ledger.ledger.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class AssetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("asset_number")
    String assetNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("acquisition_date")
    LocalDate acquisitionDate;

    @JsonProperty("cost")
    BigDecimal cost;

    @JsonProperty("salvage_value")
    BigDecimal salvageValue;

    @JsonProperty("method")
    DepreciationMethod method;

    @JsonProperty("useful_life_months")
    int usefulLifeMonths;

    @JsonProperty("declining_rate_bps")
    int decliningRateBps;

    @JsonProperty("expense_account_id")
    UUID expenseAccountId;

    @JsonProperty("accumulated_account_id")
    UUID accumulatedAccountId;

    @JsonProperty("status")
    AssetStatus status;

    @JsonProperty("disposal_date")
    LocalDate disposalDate;

    public static AssetResponse from(FixedAsset asset) {
        return AssetResponse.builder()
            .id(asset.getId())
            .assetNumber(asset.getAssetNumber())
            .name(asset.getName())
            .acquisitionDate(asset.getAcquisitionDate())
            .cost(Money.toDecimal(asset.getCost()))
            .salvageValue(Money.toDecimal(asset.getSalvageValue()))
            .method(asset.getMethod())
            .usefulLifeMonths(asset.getUsefulLifeMonths())
            .decliningRateBps(asset.getDecliningRateBps())
            .expenseAccountId(asset.getExpenseAccountId())
            .accumulatedAccountId(asset.getAccumulatedAccountId())
            .status(asset.getStatus())
            .disposalDate(asset.getDisposalDate())
            .build();
    }
}
