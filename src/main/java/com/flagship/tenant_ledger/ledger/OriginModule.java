package com.flagship.tenant_ledger.ledger;

/**
 * The business module that produced a voucher.
 */
public enum OriginModule {
    MANUAL,
    SALES,
    PURCHASE,
    EXPENSE,
    OTHER_INCOME,
    PAYROLL,
    DEPRECIATION,
    FUND_TRANSFER,
    RECONCILIATION,
    ADJUSTMENT
}
