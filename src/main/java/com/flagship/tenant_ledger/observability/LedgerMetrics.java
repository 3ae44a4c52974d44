package com.flagship.tenant_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.vouchers.posted: vouchers committed, tagged by origin module
 * - ledger.postings.rejected: postings refused by validation, tagged by error code
 * - ledger.postings.conflicts: lock timeouts and serialisation failures
 * - ledger.books.unbalanced: integrity alarms raised by statement derivation
 * - ledger.posting.duration: commit latency
 * - ledger.statement.duration: statement derivation latency, tagged by statement
 * - idempotency.cache: Idempotency-Key lookups, tagged hit/miss
 *
 * Tenant ids are deliberately not used as tags to keep cardinality bounded.
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter postingConflicts;
    private final Timer postingTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingConflicts = Counter.builder("ledger.postings.conflicts")
                .description("Posting attempts that hit tenant lock contention")
                .register(registry);

        this.postingTimer = Timer.builder("ledger.posting.duration")
                .description("Time taken to validate and commit a voucher")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordVoucherPosted(String origin) {
        registry.counter("ledger.vouchers.posted",
                "origin", sanitizeTag(origin)
        ).increment();
    }

    public void recordPostingRejected(String errorCode) {
        registry.counter("ledger.postings.rejected",
                "error_code", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordPostingConflict() {
        postingConflicts.increment();
    }

    public void recordBooksUnbalanced(String statement) {
        registry.counter("ledger.books.unbalanced",
                "statement", sanitizeTag(statement)
        ).increment();
    }

    public void recordDepreciationPosted(String method) {
        registry.counter("ledger.depreciation.posted",
                "method", sanitizeTag(method)
        ).increment();
    }

    public void recordReconciliation(String status) {
        registry.counter("ledger.reconciliations",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public <T> T timePosting(Supplier<T> operation) {
        return postingTimer.record(operation);
    }

    public void recordStatementDuration(String statement, Duration duration) {
        registry.timer("ledger.statement.duration",
                "statement", sanitizeTag(statement)
        ).record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
