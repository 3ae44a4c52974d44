package com.flagship.tenant_ledger.depreciation;

import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.exception.LedgerException;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Catches every active asset up to the last completed month.
 *
 * Disabled unless {@code ledger.depreciation.cron} is set. Each period is its
 * own transaction, so a failing asset is logged and the run moves on to the
 * next one; the failed period is picked up again by the next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DepreciationScheduler {

    private final DepreciationService depreciationService;
    private final TenantResolver tenantResolver;
    private final Clock clock;

    @Scheduled(cron = "${ledger.depreciation.cron:-}")
    public void runScheduled() {
        YearMonth upTo = YearMonth.now(clock).minusMonths(1);
        int posted = 0;
        for (Tenant tenant : tenantResolver.findTransactingTenants()) {
            try (MDC.MDCCloseable scope = CorrelationContext.tenantScope(tenant.getIdentifier())) {
                posted += runDueDepreciation(tenant, upTo);
            }
        }
        log.info("Depreciation run up to {} posted {} vouchers", upTo, posted);
    }

    /**
     * Posts every unposted period up to and including {@code upTo} for each
     * active asset of the tenant. A period with nothing due does not end the
     * catch-up; only an asset that is no longer active does.
     *
     * @return number of vouchers posted
     */
    public int runDueDepreciation(Tenant tenant, YearMonth upTo) {
        int posted = 0;
        for (FixedAsset asset : depreciationService.findActiveAssets(tenant)) {
            try {
                posted += catchUp(tenant, asset, upTo);
            } catch (LedgerException e) {
                log.error("Depreciation of asset {} for tenant {} failed: {} ({})",
                    asset.getId(), tenant.getIdentifier(), e.getMessage(), e.getErrorCode(), e);
            } catch (Exception e) {
                log.error("Depreciation of asset {} for tenant {} failed", asset.getId(), tenant.getIdentifier(), e);
            }
        }
        return posted;
    }

    private int catchUp(Tenant tenant, FixedAsset asset, YearMonth upTo) {
        int posted = 0;
        for (YearMonth period = depreciationService.nextPeriod(tenant, asset);
             !period.isAfter(upTo);
             period = period.plusMonths(1)) {
            Optional<JournalVoucher> voucher = depreciationService.runDepreciation(tenant, asset.getId(), period);
            if (voucher.isPresent()) {
                posted++;
            } else if (depreciationService.findAsset(tenant, asset.getId()).getStatus() != AssetStatus.ACTIVE) {
                break;
            }
        }
        return posted;
    }
}
