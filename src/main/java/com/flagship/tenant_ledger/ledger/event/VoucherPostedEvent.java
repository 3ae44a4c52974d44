package com.flagship.tenant_ledger.ledger.event;

import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Fact published after a voucher commits. Downstream consumers (usage
 * metering, notifications, analytics) react to it; none of them can write
 * back into the ledger.
 *
 * Written to the outbox in the posting transaction, so the event exists
 * if and only if the voucher does.
 */
@Value
public class VoucherPostedEvent {
    UUID eventId;
    UUID tenantId;
    UUID voucherId;
    String voucherNumber;
    long sequenceNumber;
    LocalDate transactionDate;
    String origin;
    String sourceType;
    String sourceId;
    long totalAmount;
    int lineCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherPosted";
    public static final String AGGREGATE_TYPE = "JournalVoucher";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static VoucherPostedEvent fromVoucher(JournalVoucher voucher) {
        SourceDocumentRef source = voucher.getSourceDocument();
        return new VoucherPostedEvent(
            UUID.randomUUID(),
            voucher.getTenantId(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getSequenceNumber(),
            voucher.getTransactionDate(),
            voucher.getOrigin().name(),
            source != null ? source.getType().name() : null,
            source != null ? source.getId() : null,
            voucher.getTotalDebit(),
            voucher.getEntries().size(),
            voucher.getPostedAt()
        );
    }
}
