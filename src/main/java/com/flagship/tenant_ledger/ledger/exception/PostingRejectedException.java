package com.flagship.tenant_ledger.ledger.exception;

/**
 * A posting request that failed validation. Nothing has been written when this is thrown.
 */
public abstract class PostingRejectedException extends LedgerException {

    protected PostingRejectedException(String errorCode, String message) {
        super(errorCode, message);
    }
}
