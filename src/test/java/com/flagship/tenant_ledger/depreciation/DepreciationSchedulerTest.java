package com.flagship.tenant_ledger.depreciation;

import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.tenant.CurrencyCode;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import com.flagship.tenant_ledger.tenant.TenantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DepreciationSchedulerTest {

    @Mock
    private DepreciationService depreciationService;

    @Mock
    private TenantResolver tenantResolver;

    private DepreciationScheduler scheduler;

    private final Tenant tenant = new Tenant(UUID.randomUUID(), "acme", "Acme Stores", TenantStatus.ACTIVE,
        CurrencyCode.NGN, 1, Instant.parse("2024-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-04-15T00:00:00Z"), ZoneOffset.UTC);
        scheduler = new DepreciationScheduler(depreciationService, tenantResolver, clock);
    }

    private static FixedAsset asset(String number) {
        return FixedAsset.builder()
            .id(UUID.randomUUID())
            .assetNumber(number)
            .name(number)
            .acquisitionDate(LocalDate.of(2024, 1, 1))
            .cost(1_000)
            .method(DepreciationMethod.STRAIGHT_LINE)
            .usefulLifeMonths(12)
            .status(AssetStatus.ACTIVE)
            .build();
    }

    @Test
    @DisplayName("A database failure on one asset does not stop the others")
    void infrastructureFailureIsIsolatedPerAsset() {
        FixedAsset broken = asset("FA-001");
        FixedAsset healthy = asset("FA-002");
        when(depreciationService.findActiveAssets(tenant)).thenReturn(List.of(broken, healthy));
        when(depreciationService.nextPeriod(eq(tenant), any())).thenReturn(YearMonth.of(2024, 3));
        when(depreciationService.runDepreciation(tenant, broken.getId(), YearMonth.of(2024, 3)))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(depreciationService.runDepreciation(tenant, healthy.getId(), YearMonth.of(2024, 3)))
            .thenReturn(Optional.of(mock(JournalVoucher.class)));

        int posted = scheduler.runDueDepreciation(tenant, YearMonth.of(2024, 3));

        assertEquals(1, posted);
        verify(depreciationService).runDepreciation(tenant, healthy.getId(), YearMonth.of(2024, 3));
    }

    @Test
    @DisplayName("A period with nothing due does not end the catch-up")
    void zeroChargePeriodIsSkippedNotFinal() {
        FixedAsset pen = asset("FA-003");
        when(depreciationService.findActiveAssets(tenant)).thenReturn(List.of(pen));
        when(depreciationService.nextPeriod(tenant, pen)).thenReturn(YearMonth.of(2024, 1));
        when(depreciationService.findAsset(tenant, pen.getId())).thenReturn(pen);
        when(depreciationService.runDepreciation(tenant, pen.getId(), YearMonth.of(2024, 1)))
            .thenReturn(Optional.empty());
        when(depreciationService.runDepreciation(tenant, pen.getId(), YearMonth.of(2024, 2)))
            .thenReturn(Optional.empty());
        when(depreciationService.runDepreciation(tenant, pen.getId(), YearMonth.of(2024, 3)))
            .thenReturn(Optional.of(mock(JournalVoucher.class)));

        int posted = scheduler.runDueDepreciation(tenant, YearMonth.of(2024, 3));

        assertEquals(1, posted);
        verify(depreciationService, times(2)).findAsset(tenant, pen.getId());
    }

    @Test
    @DisplayName("Catch-up stops once the asset is no longer active")
    void stopsWhenAssetIsRetired() {
        FixedAsset retired = asset("FA-004").toBuilder().status(AssetStatus.FULLY_DEPRECIATED).build();
        when(depreciationService.findActiveAssets(tenant)).thenReturn(List.of(retired));
        when(depreciationService.nextPeriod(tenant, retired)).thenReturn(YearMonth.of(2024, 1));
        when(depreciationService.findAsset(tenant, retired.getId())).thenReturn(retired);
        when(depreciationService.runDepreciation(tenant, retired.getId(), YearMonth.of(2024, 1)))
            .thenReturn(Optional.empty());

        assertEquals(0, scheduler.runDueDepreciation(tenant, YearMonth.of(2024, 3)));
        verify(depreciationService, times(1)).runDepreciation(eq(tenant), eq(retired.getId()), any());
    }

    @Test
    @DisplayName("Scheduled run covers every transacting tenant up to last month")
    void scheduledRunUsesLastCompletedMonth() {
        when(tenantResolver.findTransactingTenants()).thenReturn(List.of(tenant));
        when(depreciationService.findActiveAssets(tenant)).thenReturn(List.of());

        scheduler.runScheduled();

        verify(depreciationService).findActiveAssets(tenant);
    }
}
