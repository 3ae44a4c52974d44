package com.flagship.tenant_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox event.
 *
 * An outbox event is a fact that must reach Kafka. It is written in the
 * same database transaction as the ledger rows it describes and published
 * later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID tenantId;
    String aggregateType;      // e.g., "JournalVoucher"
    UUID aggregateId;          // e.g., voucher ID
    String eventType;          // e.g., "VoucherPosted"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(UUID tenantId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            tenantId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,  // not published yet
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
