package com.flagship.tenant_ledger.ledger;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A business event translated into ledger lines, ready for the posting engine.
 * Transient: it becomes a {@link JournalVoucher} once committed.
 */
@Value
@Builder(toBuilder = true)
public class PostingRequest {
    @NonNull
    OriginModule origin;
    @NonNull
    LocalDate transactionDate;
    String note;
    SourceDocumentRef sourceDocument;
    String idempotencyKey;
    @Singular
    List<PostingLine> lines;
}
