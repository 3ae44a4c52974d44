package com.flagship.tenant_ledger.tenant;

/**
 * Base currency of a tenant, ISO-4217.
 *
 * A tenant books everything in its one base currency. Every supported
 * currency has two minor-unit digits, so ledger amounts are stored as
 * integer minor units (kobo, cents, pence).
 */
public enum CurrencyCode {
    NGN, // Nigerian Naira
    GHS, // Ghanaian Cedi
    KES, // Kenyan Shilling
    ZAR, // South African Rand
    USD, // US Dollar
    EUR, // Euro
    GBP; // British Pound

    public static final int MINOR_UNIT_DIGITS = 2;
}
