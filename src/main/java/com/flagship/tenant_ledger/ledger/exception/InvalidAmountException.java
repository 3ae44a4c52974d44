package com.flagship.tenant_ledger.ledger.exception;

public class InvalidAmountException extends PostingRejectedException {

    public InvalidAmountException(String message) {
        super("INVALID_AMOUNT", message);
    }
}
