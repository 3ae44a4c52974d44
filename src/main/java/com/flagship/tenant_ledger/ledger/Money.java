package com.flagship.tenant_ledger.ledger;

import com.flagship.tenant_ledger.ledger.exception.InvalidAmountException;
import com.flagship.tenant_ledger.tenant.CurrencyCode;

import java.math.BigDecimal;

/**
 * Conversion between decimal amounts (API, reports) and the integer minor
 * units the ledger stores. Input with more fractional digits than the
 * currency allows is rejected, never rounded.
 */
public final class Money {

    private Money() {
    }

    public static long toMinorUnits(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException("Amount is required");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > CurrencyCode.MINOR_UNIT_DIGITS) {
            throw new InvalidAmountException("Amount has more than "
                + CurrencyCode.MINOR_UNIT_DIGITS + " decimal places: " + amount.toPlainString());
        }
        try {
            return amount.movePointRight(CurrencyCode.MINOR_UNIT_DIGITS).longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount out of range: " + amount.toPlainString());
        }
    }

    public static BigDecimal toDecimal(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, CurrencyCode.MINOR_UNIT_DIGITS);
    }
}
