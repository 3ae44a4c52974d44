package com.flagship.tenant_ledger.ledger;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A single committed debit or credit line.
 *
 * Immutable once written. The only later change is attaching it to a
 * reconciliation batch, which happens at most once.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID tenantId;
    UUID voucherId;
    int lineNumber;
    UUID accountId;
    LocalDate transactionDate;
    long debit;
    long credit;
    String description;
    SourceDocumentRef sourceDocument;
    UUID reconciliationBatchId;

    public boolean isReconciled() {
        return reconciliationBatchId != null;
    }

    public EntryType getEntryType() {
        return debit > 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }

    public long getAmount() {
        return debit > 0 ? debit : credit;
    }
}
