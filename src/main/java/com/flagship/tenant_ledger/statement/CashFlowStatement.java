package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.ledger.OriginModule;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Movement of the tenant's cash and bank accounts over a period, split by the
 * module that caused it. Transfers between two of the covered accounts net to
 * zero and do not appear.
 */
@Value
public class CashFlowStatement {
    LocalDate from;
    LocalDate to;
    List<UUID> cashAccountIds;
    long openingBalance;
    List<Activity> activities;
    long totalInflows;
    long totalOutflows;
    long netChange;
    long closingBalance;

    @Value
    public static class Activity {
        OriginModule origin;
        long inflows;
        long outflows;

        public long getNet() {
            return inflows - outflows;
        }
    }
}
