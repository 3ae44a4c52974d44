package com.flagship.tenant_ledger.ledger.exception;

import java.util.UUID;

/**
 * The tenant's posting lock could not be taken in time, or the database
 * reported a serialisation failure. Safe to retry.
 */
public class PostingConflictException extends LedgerException {

    public PostingConflictException(UUID tenantId, Throwable cause) {
        super("CONCURRENT_MODIFICATION",
            "Concurrent modification of tenant ledger " + tenantId + ", retry later", cause);
    }
}
