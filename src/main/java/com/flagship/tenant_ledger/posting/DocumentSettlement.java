package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Cash settling part or all of an invoice (customer receipt) or a bill
 * (supplier payment).
 */
@Value
@Builder
public class DocumentSettlement {
    @NonNull
    String documentId;
    @NonNull
    LocalDate settlementDate;
    UUID cashAccountId; // defaults to Bank
    long amount;
}
