package com.flagship.tenant_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * The committed, numbered record of one posting. Immutable after commit.
 */
@Value
public class JournalVoucher {
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
    List<LedgerEntry> entries;

    public long getTotalDebit() {
        return entries.stream().mapToLong(LedgerEntry::getDebit).sum();
    }

    public long getTotalCredit() {
        return entries.stream().mapToLong(LedgerEntry::getCredit).sum();
    }
}
