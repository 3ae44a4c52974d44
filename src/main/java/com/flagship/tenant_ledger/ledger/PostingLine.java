package com.flagship.tenant_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * One line of a posting request. Amounts are minor currency units.
 * Exactly one of debit and credit must be positive; the validator enforces
 * this so that a bad line is reported as a rejection rather than a crash.
 */
@Value
public class PostingLine {
    UUID accountId;
    long debit;
    long credit;
    String description;

    public static PostingLine debit(UUID accountId, long amount, String description) {
        return new PostingLine(accountId, amount, 0L, description);
    }

    public static PostingLine credit(UUID accountId, long amount, String description) {
        return new PostingLine(accountId, 0L, amount, description);
    }
}
