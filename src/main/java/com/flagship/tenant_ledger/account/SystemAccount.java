package com.flagship.tenant_ledger.account;

/**
 * Accounts seeded for every tenant at onboarding. Producers locate them by
 * role, never by name, so a tenant may rename them freely.
 */
public enum SystemAccount {
    CASH("1000", "Cash", AccountType.ASSET),
    BANK("1100", "Bank", AccountType.ASSET),
    ACCOUNTS_RECEIVABLE("1200", "Accounts Receivable", AccountType.ASSET),
    INVENTORY("1300", "Inventory", AccountType.ASSET),
    VAT_REFUNDABLE("1400", "VAT Refundable", AccountType.ASSET),
    FIXED_ASSETS("1500", "Fixed Assets", AccountType.ASSET),
    // contra-asset, carries a credit balance
    ACCUMULATED_DEPRECIATION("1510", "Accumulated Depreciation", AccountType.ASSET),
    ACCOUNTS_PAYABLE("2000", "Accounts Payable", AccountType.LIABILITY),
    VAT_PAYABLE("2100", "VAT Payable", AccountType.LIABILITY),
    PAYE_PAYABLE("2200", "PAYE Payable", AccountType.LIABILITY),
    PENSION_PAYABLE("2210", "Pension Payable", AccountType.LIABILITY),
    PAYROLL_LIABILITIES("2300", "Payroll Liabilities", AccountType.LIABILITY),
    OWNERS_CAPITAL("3000", "Owner's Capital", AccountType.EQUITY),
    RETAINED_EARNINGS("3100", "Retained Earnings", AccountType.EQUITY),
    SALES_REVENUE("4000", "Sales Revenue", AccountType.REVENUE),
    OTHER_INCOME("4100", "Other Income", AccountType.REVENUE),
    COST_OF_GOODS_SOLD("5000", "Cost of Goods Sold", AccountType.EXPENSE),
    SALARIES_AND_WAGES("5100", "Salaries & Wages", AccountType.EXPENSE),
    BANK_CHARGES("5700", "Bank Charges", AccountType.EXPENSE),
    DEPRECIATION_EXPENSE("5900", "Depreciation Expense", AccountType.EXPENSE),
    LOSS_ON_DISPOSAL("5950", "Loss on Asset Disposal", AccountType.EXPENSE);

    private final String code;
    private final String defaultName;
    private final AccountType type;

    SystemAccount(String code, String defaultName, AccountType type) {
        this.code = code;
        this.defaultName = defaultName;
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultName() {
        return defaultName;
    }

    public AccountType getType() {
        return type;
    }
}
