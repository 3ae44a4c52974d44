package com.flagship.tenant_ledger.depreciation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DepreciationCalculatorTest {

    private static FixedAsset.FixedAssetBuilder asset() {
        return FixedAsset.builder()
            .id(UUID.randomUUID())
            .tenantId(UUID.randomUUID())
            .assetNumber("FA-001")
            .name("Delivery van")
            .acquisitionDate(LocalDate.of(2024, 1, 10))
            .status(AssetStatus.ACTIVE);
    }

    @Nested
    @DisplayName("Straight line")
    class StraightLine {

        // 1,000.00 cost, 100.00 salvage, 12 months: 75.00 a month
        private final FixedAsset van = asset()
            .cost(100_000).salvageValue(10_000)
            .method(DepreciationMethod.STRAIGHT_LINE)
            .usefulLifeMonths(12)
            .build();

        @Test
        void chargesEqualMonthlyAmount() {
            assertEquals(7_500, DepreciationCalculator.chargeFor(van, YearMonth.of(2024, 1), 0));
            assertEquals(7_500, DepreciationCalculator.chargeFor(van, YearMonth.of(2024, 6), 37_500));
        }

        @Test
        @DisplayName("Nothing is due before the acquisition month")
        void nothingBeforeAcquisition() {
            assertEquals(0, DepreciationCalculator.chargeFor(van, YearMonth.of(2023, 12), 0));
        }

        @Test
        @DisplayName("Final period absorbs the rounding remainder")
        void finalPeriodAbsorbsRemainder() {
            FixedAsset laptop = van.toBuilder().cost(100_000).salvageValue(0).usefulLifeMonths(3).build();

            long first = DepreciationCalculator.chargeFor(laptop, YearMonth.of(2024, 1), 0);
            long second = DepreciationCalculator.chargeFor(laptop, YearMonth.of(2024, 2), first);
            long third = DepreciationCalculator.chargeFor(laptop, YearMonth.of(2024, 3), first + second);

            assertEquals(33_333, first);
            assertEquals(33_333, second);
            assertEquals(33_334, third);
            assertEquals(100_000, first + second + third);
        }

        @Test
        @DisplayName("Depreciable amount below the life in months still spreads over the life")
        void smallAmountFollowsCumulativeSchedule() {
            FixedAsset stapler = van.toBuilder().cost(5).salvageValue(0).build();

            long accumulated = 0;
            long[] charges = new long[12];
            for (int month = 0; month < 12; month++) {
                charges[month] = DepreciationCalculator.chargeFor(stapler, YearMonth.of(2024, 1).plusMonths(month), accumulated);
                accumulated += charges[month];
            }

            assertArrayEquals(new long[] {0, 0, 1, 0, 1, 0, 0, 1, 0, 1, 0, 1}, charges);
            assertEquals(5, accumulated);
        }

        @Test
        @DisplayName("A skipped period is caught up by the next one")
        void skippedPeriodIsCaughtUp() {
            assertEquals(15_000, DepreciationCalculator.chargeFor(van, YearMonth.of(2024, 2), 0));
        }

        @Test
        @DisplayName("Accumulated depreciation never passes cost minus salvage")
        void neverExceedsDepreciableAmount() {
            long accumulated = 0;
            for (int month = 1; month <= 18; month++) {
                accumulated += DepreciationCalculator.chargeFor(van, YearMonth.of(2024, 1).plusMonths(month - 1), accumulated);
            }

            assertEquals(90_000, accumulated);
            assertTrue(DepreciationCalculator.isFullyDepreciated(van, accumulated));
            assertEquals(0, DepreciationCalculator.chargeFor(van, YearMonth.of(2025, 7), accumulated));
        }
    }

    @Nested
    @DisplayName("Declining balance")
    class DecliningBalance {

        // 10% of net book value per month, 12 months, salvage 100.00
        private final FixedAsset machine = asset()
            .cost(100_000).salvageValue(10_000)
            .method(DepreciationMethod.DECLINING_BALANCE)
            .usefulLifeMonths(12)
            .decliningRateBps(1_000)
            .build();

        @Test
        void appliesRateToNetBookValue() {
            assertEquals(10_000, DepreciationCalculator.chargeFor(machine, YearMonth.of(2024, 1), 0));
            assertEquals(9_000, DepreciationCalculator.chargeFor(machine, YearMonth.of(2024, 2), 10_000));
        }

        @Test
        void roundsHalfUp() {
            // 10% of 999.95 is 99.995
            assertEquals(10_000, DepreciationCalculator.chargeFor(machine, YearMonth.of(2024, 2), 5));
        }

        @Test
        @DisplayName("Charge is capped so book value stops at salvage")
        void cappedAtSalvage() {
            FixedAsset aggressive = machine.toBuilder().decliningRateBps(5_000).build();

            assertEquals(5_000, DepreciationCalculator.chargeFor(aggressive, YearMonth.of(2024, 4), 85_000));
        }

        @Test
        @DisplayName("Last period of the useful life writes down to salvage")
        void lastPeriodWritesDownToSalvage() {
            assertEquals(21_000, DepreciationCalculator.chargeFor(machine, YearMonth.of(2024, 12), 69_000));
        }
    }
}
