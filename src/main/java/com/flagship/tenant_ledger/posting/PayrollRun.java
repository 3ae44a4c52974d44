package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Totals of one approved payroll run.
 */
@Value
@Builder
public class PayrollRun {
    @NonNull
    String runId;
    @NonNull
    LocalDate payDate;
    long grossPay;
    long payeTax;
    long pensionContribution;
    UUID payingAccountId; // defaults to Bank

    public long getNetPay() {
        return grossPay - payeTax - pensionContribution;
    }
}
