package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.statement.AgingBucket;
import com.flagship.tenant_ledger.statement.AgingKind;
import com.flagship.tenant_ledger.statement.AgingReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AgingReportResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("kind")
    AgingKind kind;

    @JsonProperty("counterparties")
    List<Counterparty> counterparties;

    @JsonProperty("bucket_totals")
    Map<AgingBucket, BigDecimal> bucketTotals;

    @JsonProperty("total_open")
    BigDecimal totalOpen;

    public static AgingReportResponse from(AgingReport report) {
        return AgingReportResponse.builder()
            .asOf(report.getAsOf())
            .kind(report.getKind())
            .counterparties(report.getCounterparties().stream()
                .map(counterparty -> new Counterparty(
                    counterparty.getCounterparty(),
                    counterparty.getDocuments().stream().map(Document::from).toList(),
                    toDecimal(counterparty.getBuckets()),
                    Money.toDecimal(counterparty.getTotal())))
                .toList())
            .bucketTotals(toDecimal(report.getBucketTotals()))
            .totalOpen(Money.toDecimal(report.getTotalOpen()))
            .build();
    }

    private static Map<AgingBucket, BigDecimal> toDecimal(Map<AgingBucket, Long> buckets) {
        Map<AgingBucket, BigDecimal> result = new EnumMap<>(AgingBucket.class);
        buckets.forEach((bucket, amount) -> result.put(bucket, Money.toDecimal(amount)));
        return result;
    }

    @Value
    public static class Counterparty {
        @JsonProperty("name")
        String name;
        @JsonProperty("documents")
        List<Document> documents;
        @JsonProperty("buckets")
        Map<AgingBucket, BigDecimal> buckets;
        @JsonProperty("total")
        BigDecimal total;
    }

    @Value
    public static class Document {
        @JsonProperty("document_id")
        String documentId;
        @JsonProperty("document_date")
        LocalDate documentDate;
        @JsonProperty("due_date")
        LocalDate dueDate;
        @JsonProperty("document_total")
        BigDecimal documentTotal;
        @JsonProperty("open_balance")
        BigDecimal openBalance;
        @JsonProperty("days_past_due")
        long daysPastDue;
        @JsonProperty("bucket")
        AgingBucket bucket;

        static Document from(AgingReport.Item item) {
            return new Document(item.getDocumentId(), item.getDocumentDate(), item.getDueDate(),
                Money.toDecimal(item.getDocumentTotal()), Money.toDecimal(item.getOpenBalance()),
                item.getDaysPastDue(), item.getBucket());
        }
    }
}
