package com.flagship.tenant_ledger.ledger.exception;

import java.util.UUID;

public class InvalidTransferException extends PostingRejectedException {

    public InvalidTransferException(UUID accountId) {
        super("INVALID_TRANSFER", "Source and destination accounts must differ: " + accountId);
    }
}
