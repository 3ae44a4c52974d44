package com.flagship.tenant_ledger.tenant;

import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.exception.TenantAlreadyExistsException;
import com.flagship.tenant_ledger.ledger.exception.TenantNotFoundException;
import com.flagship.tenant_ledger.ledger.exception.TenantProvisioningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Creates tenants and manages their lifecycle.
 *
 * Onboarding runs in one transaction:
 * 1. Insert the tenant in TRIAL status
 * 2. Seed the system chart of accounts
 * 3. Verify every system role is present, otherwise roll everything back
 *
 * Tenants are never deleted. They are suspended and reactivated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantOnboardingService {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$");

    private final TenantRepository tenantRepository;
    private final ChartOfAccountsService chartOfAccountsService;

    @Transactional
    public Tenant onboard(String identifier, String businessName,
                          CurrencyCode baseCurrency, int fiscalYearStartMonth) {
        String normalized = identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        if (!IDENTIFIER.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid tenant identifier: " + identifier);
        }
        if (businessName == null || businessName.isBlank()) {
            throw new IllegalArgumentException("Business name is required");
        }
        if (fiscalYearStartMonth < 1 || fiscalYearStartMonth > 12) {
            throw new IllegalArgumentException("Fiscal year start month must be 1-12: " + fiscalYearStartMonth);
        }
        if (tenantRepository.existsByIdentifier(normalized)) {
            throw new TenantAlreadyExistsException(normalized);
        }

        CurrencyCode currency = baseCurrency != null ? baseCurrency : CurrencyCode.NGN;
        TenantEntity entity = TenantEntity.newTenant(normalized, businessName.trim(), currency, fiscalYearStartMonth);
        Tenant tenant = tenantRepository.saveAndFlush(entity).toDomain();

        chartOfAccountsService.seedSystemAccounts(tenant);

        Set<SystemAccount> missing = EnumSet.allOf(SystemAccount.class);
        missing.removeAll(chartOfAccountsService.findSystemRoles(tenant));
        if (!missing.isEmpty()) {
            log.error("Provisioning of tenant {} incomplete, missing system accounts {}", normalized, missing);
            throw new TenantProvisioningException(normalized, missing);
        }

        log.info("Onboarded tenant: identifier={}, id={}, currency={}", normalized, tenant.getId(), currency);
        return tenant;
    }

    @Transactional
    public Tenant suspend(String identifier) {
        return changeStatus(identifier, TenantStatus.SUSPENDED);
    }

    @Transactional
    public Tenant activate(String identifier) {
        return changeStatus(identifier, TenantStatus.ACTIVE);
    }

    private Tenant changeStatus(String identifier, TenantStatus status) {
        String normalized = identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        TenantEntity entity = tenantRepository.findByIdentifier(normalized)
            .orElseThrow(() -> new TenantNotFoundException(normalized));
        TenantStatus previous = entity.getStatus();
        entity.changeStatus(status);
        Tenant tenant = tenantRepository.save(entity).toDomain();
        log.info("Tenant {} status changed: {} -> {}", normalized, previous, status);
        return tenant;
    }
}
