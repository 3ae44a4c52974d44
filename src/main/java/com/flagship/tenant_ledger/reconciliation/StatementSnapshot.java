package com.flagship.tenant_ledger.reconciliation;

import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

/**
 * What the bank says: the closing balance on a statement date, in the
 * reconciled account's normal-balance sign (for a bank asset account, money held).
 */
@Value
public class StatementSnapshot {
    @NonNull
    LocalDate statementDate;
    long closingBalance;
}
