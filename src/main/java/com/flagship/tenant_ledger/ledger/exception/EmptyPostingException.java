package com.flagship.tenant_ledger.ledger.exception;

public class EmptyPostingException extends PostingRejectedException {

    public EmptyPostingException() {
        super("EMPTY_POSTING", "Posting request has no lines");
    }
}
