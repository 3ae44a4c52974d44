package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A sales invoice as issued by the sales module. Amounts in minor units.
 */
@Value
@Builder
public class SalesInvoice {
    @NonNull
    String invoiceId;
    String customer;
    @NonNull
    LocalDate invoiceDate;
    LocalDate dueDate;
    long subtotal;
    long discount;
    BigDecimal vatRatePercent;
    long costOfGoods;
    boolean cashSale;
    UUID depositAccountId;  // cash sales only; defaults to Cash
    UUID revenueAccountId;  // defaults to Sales Revenue
}
