package com.flagship.tenant_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A journal_vouchers row without its lines.
 */
@Value
public class VoucherHeader {
    UUID id;
    UUID tenantId;
    String voucherNumber;
    long sequenceNumber;
    LocalDate transactionDate;
    String note;
    OriginModule origin;
    SourceDocumentRef sourceDocument;
    String idempotencyKey;
    Instant postedAt;

    public JournalVoucher withEntries(List<LedgerEntry> entries) {
        return new JournalVoucher(id, tenantId, voucherNumber, sequenceNumber, transactionDate, note,
            origin, sourceDocument, idempotencyKey, postedAt, List.copyOf(entries));
    }
}
