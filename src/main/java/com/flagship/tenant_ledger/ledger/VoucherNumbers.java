package com.flagship.tenant_ledger.ledger;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Voucher number format: {@code JV-<yyyy>-<nnnnnn>}, where the year is the
 * transaction year and the suffix is the tenant's zero-padded sequence.
 * The sequence is tenant-wide and is not reset at year end.
 */
public final class VoucherNumbers {

    private static final Pattern FORMAT = Pattern.compile("^JV-(\\d{4})-(\\d{6,})$");

    private VoucherNumbers() {
    }

    public static String format(LocalDate transactionDate, long sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("Voucher sequence must be positive: " + sequence);
        }
        return String.format("JV-%04d-%06d", transactionDate.getYear(), sequence);
    }

    public static long sequenceOf(String voucherNumber) {
        Matcher matcher = FORMAT.matcher(voucherNumber);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a voucher number: " + voucherNumber);
        }
        return Long.parseLong(matcher.group(2));
    }
}
