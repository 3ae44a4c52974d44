package com.flagship.tenant_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - Ledger postings (in logs, next to the tenant and voucher number)
 * - Outbox events (as a Kafka header)
 *
 * The tenant is never read from here. Core operations take it as a parameter;
 * the MDC key exists only so log lines carry it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String TENANT_ID_HEADER = "X-Tenant-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String VOUCHER_NUMBER_MDC_KEY = "voucherNumber";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Clears the correlation ID from the current thread.
     * Should be called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the tenant identifier in MDC until the returned scope is closed.
     * Work that runs outside an HTTP request (schedulers, executors) uses this
     * so its log lines carry the tenant too.
     */
    public static MDC.MDCCloseable tenantScope(String tenantIdentifier) {
        return MDC.putCloseable(TENANT_ID_MDC_KEY, tenantIdentifier);
    }

    public static MDC.MDCCloseable voucherScope(String voucherNumber) {
        return MDC.putCloseable(VOUCHER_NUMBER_MDC_KEY, voucherNumber);
    }
}
