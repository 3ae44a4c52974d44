package com.flagship.tenant_ledger.ledger;

public enum SourceDocumentType {
    SALES_INVOICE,
    PURCHASE_BILL,
    EXPENSE,
    INCOME,
    PAYROLL_RUN,
    FUND_TRANSFER,
    FIXED_ASSET,
    BANK_STATEMENT
}
