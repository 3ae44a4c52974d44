package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class VoucherResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("voucher_number")
    String voucherNumber;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("origin")
    OriginModule origin;

    @JsonProperty("note")
    String note;

    @JsonProperty("source_type")
    SourceDocumentType sourceType;

    @JsonProperty("source_id")
    String sourceId;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("lines")
    List<Line> lines;

    public static VoucherResponse from(JournalVoucher voucher) {
        return VoucherResponse.builder()
            .id(voucher.getId())
            .voucherNumber(voucher.getVoucherNumber())
            .transactionDate(voucher.getTransactionDate())
            .origin(voucher.getOrigin())
            .note(voucher.getNote())
            .sourceType(voucher.getSourceDocument() != null ? voucher.getSourceDocument().getType() : null)
            .sourceId(voucher.getSourceDocument() != null ? voucher.getSourceDocument().getId() : null)
            .total(Money.toDecimal(voucher.getTotalDebit()))
            .postedAt(voucher.getPostedAt())
            .lines(voucher.getEntries().stream().map(Line::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class Line {

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("description")
        String description;

        @JsonProperty("reconciled")
        boolean reconciled;

        static Line from(LedgerEntry entry) {
            return Line.builder()
                .lineNumber(entry.getLineNumber())
                .accountId(entry.getAccountId())
                .debit(Money.toDecimal(entry.getDebit()))
                .credit(Money.toDecimal(entry.getCredit()))
                .description(entry.getDescription())
                .reconciled(entry.isReconciled())
                .build();
        }
    }
}
