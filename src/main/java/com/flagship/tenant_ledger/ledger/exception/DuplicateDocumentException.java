package com.flagship.tenant_ledger.ledger.exception;

import com.flagship.tenant_ledger.ledger.SourceDocumentType;

public class DuplicateDocumentException extends LedgerException {

    public DuplicateDocumentException(SourceDocumentType type, String documentId) {
        super("DUPLICATE_DOCUMENT", type + " '" + documentId + "' has already been posted");
    }
}
