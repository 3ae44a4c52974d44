package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A manual journal entry. Amounts are decimal major units (e.g. 11500.00);
 * more than two fractional digits is rejected.
 *
 * Balance and line rules are checked by the posting engine, not here, so an
 * unbalanced or empty entry gets the engine's error code.
 */
@Value
@Builder
@Jacksonized
public class PostJournalRequest {

    @NotNull(message = "Transaction date is required")
    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    String note;

    @JsonProperty("source_type")
    SourceDocumentType sourceType;

    @JsonProperty("source_id")
    String sourceId;

    @NotNull(message = "Lines are required")
    @Valid
    @JsonProperty("lines")
    List<Line> lines;

    @Value
    @Builder
    @Jacksonized
    public static class Line {

        @NotNull(message = "Account ID is required")
        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("description")
        String description;
    }
}
