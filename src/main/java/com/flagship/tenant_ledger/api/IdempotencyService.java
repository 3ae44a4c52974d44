package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency-Key lookups for the journal endpoint.
 *
 * Strategy:
 * 1. Try Redis first (fast, but may be unavailable)
 * 2. Fall back to the unique (tenant_id, idempotency_key) column on journal_vouchers
 * 3. Cache database hits in Redis for later retries
 *
 * Redis only maps keys to voucher numbers. The database stays the source of
 * truth, so a Redis outage never lets a retried request post twice.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final LedgerService ledgerService;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(LedgerService ledgerService,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${ledger.idempotency.ttl:7d}") Duration ttl) {
        this.ledgerService = ledgerService;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * @return the voucher already posted under this key, if any
     */
    public Optional<JournalVoucher> findExisting(Tenant tenant, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }

        Optional<String> cached = readCache(tenant, idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return Optional.of(ledgerService.findVoucher(tenant, cached.get()));
        }

        Optional<JournalVoucher> existing = ledgerService.findByIdempotencyKey(tenant, idempotencyKey);
        existing.ifPresent(voucher -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            remember(tenant, idempotencyKey, voucher);
        });
        return existing;
    }

    /**
     * Caches the key to voucher-number mapping. Best effort: the voucher row
     * already carries the key.
     */
    public void remember(Tenant tenant, String idempotencyKey, JournalVoucher voucher) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(tenant, idempotencyKey), voucher.getVoucherNumber(), ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private Optional<String> readCache(Tenant tenant, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(redisKey(tenant, idempotencyKey)));
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private static String redisKey(Tenant tenant, String idempotencyKey) {
        return REDIS_KEY_PREFIX + tenant.getId() + ":" + idempotencyKey;
    }
}
