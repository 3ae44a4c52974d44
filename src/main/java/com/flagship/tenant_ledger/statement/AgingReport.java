package com.flagship.tenant_ledger.statement;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
public class AgingReport {
    LocalDate asOf;
    AgingKind kind;
    List<CounterpartyAging> counterparties;
    Map<AgingBucket, Long> bucketTotals;
    long totalOpen;

    @Value
    public static class CounterpartyAging {
        String counterparty;
        List<Item> documents;
        Map<AgingBucket, Long> buckets;
        long total;
    }

    @Value
    public static class Item {
        String documentId;
        LocalDate documentDate;
        LocalDate dueDate;
        long documentTotal;
        long openBalance;
        long daysPastDue;
        AgingBucket bucket;
    }
}
