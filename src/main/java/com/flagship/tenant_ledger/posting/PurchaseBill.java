package com.flagship.tenant_ledger.posting;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PurchaseBill {
    @NonNull
    String billId;
    String supplier;
    @NonNull
    LocalDate billDate;
    LocalDate dueDate;
    long subtotal;
    long discount;
    BigDecimal vatRatePercent;
    UUID debitAccountId; // defaults to Inventory; an expense account for non-stock purchases
}
