package com.flagship.tenant_ledger.ledger.exception;

public class VoucherNotFoundException extends LedgerException {

    public VoucherNotFoundException(String voucherNumber) {
        super("VOUCHER_NOT_FOUND", "Journal voucher not found: " + voucherNumber);
    }
}
