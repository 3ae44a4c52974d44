package com.flagship.tenant_ledger.document;

import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * The part of a collaborator's business document (invoice, bill) the ledger
 * needs for aging. The document itself lives with its owning module.
 */
@Value
@Builder
public class SourceDocument {
    UUID tenantId;
    SourceDocumentType type;
    String documentId;
    String counterparty;
    LocalDate documentDate;
    LocalDate dueDate;
    long total;

    public SourceDocumentRef toRef() {
        return SourceDocumentRef.of(type, documentId);
    }
}
