package com.flagship.tenant_ledger.tenant;

import com.flagship.tenant_ledger.ledger.exception.TenantNotFoundException;
import com.flagship.tenant_ledger.ledger.exception.TenantSuspendedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Maps a tenant identifier (the subdomain-style key carried by requests) to a
 * resolved {@link Tenant}.
 *
 * Resolution is a pure lookup: an unknown identifier is an error, there is no
 * default tenant, and a suspended tenant is refused.
 */
@Service
@RequiredArgsConstructor
public class TenantResolver {

    private final TenantRepository tenantRepository;

    @Transactional(readOnly = true)
    public Tenant resolveTenant(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new TenantNotFoundException(String.valueOf(identifier));
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        Tenant tenant = tenantRepository.findByIdentifier(normalized)
            .map(TenantEntity::toDomain)
            .orElseThrow(() -> new TenantNotFoundException(normalized));
        if (tenant.isSuspended()) {
            throw new TenantSuspendedException(normalized);
        }
        return tenant;
    }

    /**
     * Tenants that may still post, used by background jobs.
     */
    @Transactional(readOnly = true)
    public List<Tenant> findTransactingTenants() {
        return tenantRepository.findByStatusNot(TenantStatus.SUSPENDED).stream()
            .map(TenantEntity::toDomain)
            .toList();
    }
}
