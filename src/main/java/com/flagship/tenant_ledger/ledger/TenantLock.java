package com.flagship.tenant_ledger.ledger;

import com.flagship.tenant_ledger.ledger.exception.PostingConflictException;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.UUID;

/**
 * Serialises writers of one tenant's ledger with a transaction-scoped
 * PostgreSQL advisory lock keyed on the tenant id.
 *
 * Different tenants map to different keys and never wait on each other.
 * The lock is released automatically at commit or rollback. The wait is
 * bounded by {@code ledger.posting.lock-timeout}; a timeout surfaces as
 * {@link PostingConflictException}.
 */
@Component
@Slf4j
public class TenantLock {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final Duration lockTimeout;

    public TenantLock(JdbcTemplate jdbcTemplate,
                      LedgerMetrics ledgerMetrics,
                      @Value("${ledger.posting.lock-timeout:5s}") Duration lockTimeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.ledgerMetrics = ledgerMetrics;
        this.lockTimeout = lockTimeout;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(UUID tenantId) {
        long key = lockKey(tenantId);
        try {
            jdbcTemplate.queryForObject("SELECT set_config('lock_timeout', ?, true)",
                String.class, lockTimeout.toMillis() + "ms");
            jdbcTemplate.queryForObject("SELECT pg_advisory_xact_lock(?)::text", String.class, key);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Timed out waiting for ledger lock: tenantId={}, timeout={}", tenantId, lockTimeout);
            ledgerMetrics.recordPostingConflict();
            throw new PostingConflictException(tenantId, e);
        }
    }

    /**
     * Folds the 128-bit tenant id into the 64-bit advisory lock key space.
     */
    static long lockKey(UUID tenantId) {
        return tenantId.getMostSignificantBits() ^ tenantId.getLeastSignificantBits();
    }
}
