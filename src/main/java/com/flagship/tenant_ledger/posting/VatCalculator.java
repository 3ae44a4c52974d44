package com.flagship.tenant_ledger.posting;

import com.flagship.tenant_ledger.ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * VAT on a document: computed on the net amount after discount, rounded
 * half-up to the minor unit.
 */
public final class VatCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private VatCalculator() {
    }

    public static long netAmount(long subtotal, long discount) {
        if (subtotal < 0 || discount < 0) {
            throw new InvalidAmountException("Subtotal and discount must not be negative");
        }
        if (discount > subtotal) {
            throw new InvalidAmountException("Discount " + discount + " exceeds subtotal " + subtotal);
        }
        return subtotal - discount;
    }

    /**
     * @param net        amount after discount, minor units
     * @param ratePercent VAT rate in percent, e.g. 7.5
     */
    public static long vat(long net, BigDecimal ratePercent) {
        if (ratePercent == null || ratePercent.signum() == 0) {
            return 0L;
        }
        if (ratePercent.signum() < 0) {
            throw new InvalidAmountException("VAT rate must not be negative: " + ratePercent);
        }
        return BigDecimal.valueOf(net)
            .multiply(ratePercent)
            .divide(HUNDRED, 0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}
