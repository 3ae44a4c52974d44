package com.flagship.tenant_ledger.ledger.exception;

/**
 * Base type for every failure raised by the ledger core.
 *
 * Failures fall into three families:
 * 1. Rejections (bad input, unknown tenant/account): raised before any write, never retried
 * 2. Contention ({@link PostingConflictException}): retried with backoff
 * 3. Integrity alarms ({@link BooksUnbalancedException}): fatal, never repaired automatically
 *
 * The error code is stable and is what API clients should branch on.
 */
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
