package com.flagship.tenant_ledger.statement;

/**
 * Days past due, measured from the document's due date to the report date.
 */
public enum AgingBucket {
    CURRENT,
    DAYS_1_30,
    DAYS_31_60,
    DAYS_61_90,
    OVER_90;

    public static AgingBucket forDaysPastDue(long days) {
        if (days <= 0) {
            return CURRENT;
        }
        if (days <= 30) {
            return DAYS_1_30;
        }
        if (days <= 60) {
            return DAYS_31_60;
        }
        if (days <= 90) {
            return DAYS_61_90;
        }
        return OVER_90;
    }
}
