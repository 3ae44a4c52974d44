package com.flagship.tenant_ledger.depreciation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;

/**
 * Computes the depreciation charge for one asset and one monthly period.
 *
 * The charge depends on what has already been posted, so a period that was
 * skipped is caught up by the next run and the total never exceeds
 * cost minus salvage.
 */
public final class DepreciationCalculator {

    private static final BigDecimal BASIS_POINTS = BigDecimal.valueOf(10_000);

    private DepreciationCalculator() {
    }

    /**
     * @param asset the asset
     * @param period the period being charged
     * @param accumulated depreciation already posted for the asset
     * @return the charge in minor units, 0 when nothing is due
     */
    public static long chargeFor(FixedAsset asset, YearMonth period, long accumulated) {
        long periodIndex = asset.periodIndex(period);
        long remaining = asset.getDepreciableAmount() - accumulated;
        if (periodIndex < 1 || remaining <= 0) {
            return 0;
        }
        // the last period of the useful life writes the asset down to salvage
        if (periodIndex >= asset.getUsefulLifeMonths()) {
            return remaining;
        }
        long charge = switch (asset.getMethod()) {
            case STRAIGHT_LINE -> straightLineCharge(asset, periodIndex, accumulated);
            case DECLINING_BALANCE -> decliningBalanceCharge(asset, accumulated);
        };
        return Math.min(charge, remaining);
    }

    /**
     * Cumulative schedule: after period k the asset carries
     * {@code depreciable * k / life} of accumulated depreciation. Small
     * depreciable amounts therefore post in some periods and not in others
     * instead of rounding every period down to nothing.
     */
    private static long straightLineCharge(FixedAsset asset, long periodIndex, long accumulated) {
        long scheduled = BigDecimal.valueOf(asset.getDepreciableAmount())
            .multiply(BigDecimal.valueOf(periodIndex))
            .divide(BigDecimal.valueOf(asset.getUsefulLifeMonths()), 0, RoundingMode.DOWN)
            .longValueExact();
        return Math.max(0, scheduled - accumulated);
    }

    private static long decliningBalanceCharge(FixedAsset asset, long accumulated) {
        long netBookValue = asset.getCost() - accumulated;
        return BigDecimal.valueOf(netBookValue)
            .multiply(BigDecimal.valueOf(asset.getDecliningRateBps()))
            .divide(BASIS_POINTS, 0, RoundingMode.HALF_UP)
            .longValueExact();
    }

    public static boolean isFullyDepreciated(FixedAsset asset, long accumulated) {
        return accumulated >= asset.getDepreciableAmount();
    }
}
