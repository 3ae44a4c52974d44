package com.flagship.tenant_ledger.tenant;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A resolved tenant. Its id is the isolation key stored as {@code tenant_id}
 * on every ledger row, and every core operation takes the tenant explicitly.
 */
@Value
public class Tenant {
    UUID id;
    String identifier;
    String businessName;
    TenantStatus status;
    CurrencyCode baseCurrency;
    int fiscalYearStartMonth;
    Instant createdAt;

    public boolean isSuspended() {
        return status == TenantStatus.SUSPENDED;
    }
}
