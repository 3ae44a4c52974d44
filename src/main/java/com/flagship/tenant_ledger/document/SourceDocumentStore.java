package com.flagship.tenant_ledger.document;

import com.flagship.tenant_ledger.ledger.SourceDocumentType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Port to the documents owned by the sales and purchasing modules.
 * Lookups are always tenant-scoped.
 */
public interface SourceDocumentStore {

    /**
     * Records a newly posted document. A document is registered once; a second
     * registration of the same (tenant, type, id) is rejected and leaves the
     * stored document untouched.
     *
     * @throws com.flagship.tenant_ledger.ledger.exception.DuplicateDocumentException if already registered
     */
    void register(SourceDocument document);

    Optional<SourceDocument> find(UUID tenantId, SourceDocumentType type, String documentId);

    /**
     * Documents of a type issued on or before the given date.
     */
    List<SourceDocument> findIssuedOnOrBefore(UUID tenantId, SourceDocumentType type, LocalDate asOf);
}
