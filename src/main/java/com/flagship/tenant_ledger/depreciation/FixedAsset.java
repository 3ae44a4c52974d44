package com.flagship.tenant_ledger.depreciation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A depreciable asset registered against a tenant. Amounts are minor units.
 */
@Value
@Builder(toBuilder = true)
public class FixedAsset {
    UUID id;
    UUID tenantId;
    String assetNumber;
    String name;
    LocalDate acquisitionDate;
    long cost;
    long salvageValue;
    DepreciationMethod method;
    int usefulLifeMonths;
    /** Per-period rate in basis points; only used by declining balance. */
    int decliningRateBps;
    UUID expenseAccountId;
    UUID accumulatedAccountId;
    AssetStatus status;
    /** Set only once the asset is disposed. */
    LocalDate disposalDate;
    Long disposalProceeds;

    public long getDepreciableAmount() {
        return cost - salvageValue;
    }

    /**
     * The month of acquisition is the first depreciation period.
     */
    public YearMonth getFirstPeriod() {
        return YearMonth.from(acquisitionDate);
    }

    /**
     * 1-based index of a period within the asset's life; 0 or less before acquisition.
     */
    public long periodIndex(YearMonth period) {
        return ChronoUnit.MONTHS.between(getFirstPeriod(), period) + 1;
    }
}
