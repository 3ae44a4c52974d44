package com.flagship.tenant_ledger.ledger.exception;

import java.util.UUID;

/**
 * Integrity alarm: a derived statement does not net to zero. This means the
 * stored ledger is inconsistent and needs human investigation.
 */
public class BooksUnbalancedException extends LedgerException {

    private final UUID tenantId;
    private final long difference;

    public BooksUnbalancedException(UUID tenantId, String statement, long difference) {
        super("BOOKS_UNBALANCED",
            String.format("%s for tenant %s is out of balance by %d", statement, tenantId, difference));
        this.tenantId = tenantId;
        this.difference = difference;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public long getDifference() {
        return difference;
    }
}
