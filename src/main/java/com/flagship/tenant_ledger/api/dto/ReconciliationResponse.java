package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.reconciliation.ReconciliationResult;
import com.flagship.tenant_ledger.reconciliation.ReconciliationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("batch_id")
    UUID batchId;

    @JsonProperty("status")
    ReconciliationStatus status;

    @JsonProperty("matched_entries")
    List<UUID> matchedEntries;

    @JsonProperty("matched_total")
    BigDecimal matchedTotal;

    @JsonProperty("discrepancy")
    BigDecimal discrepancy;

    public static ReconciliationResponse from(ReconciliationResult result) {
        return ReconciliationResponse.builder()
            .batchId(result.getBatchId())
            .status(result.getStatus())
            .matchedEntries(result.getMatchedEntries())
            .matchedTotal(Money.toDecimal(result.getMatchedTotal()))
            .discrepancy(Money.toDecimal(result.getDiscrepancy()))
            .build();
    }
}
