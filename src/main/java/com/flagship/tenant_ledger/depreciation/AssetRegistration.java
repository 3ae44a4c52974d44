package com.flagship.tenant_ledger.depreciation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for registering a fixed asset. When the account ids are left out the
 * tenant's Depreciation Expense and Accumulated Depreciation system accounts are used.
 */
@Value
@Builder
public class AssetRegistration {
    String assetNumber;
    @NonNull
    String name;
    @NonNull
    LocalDate acquisitionDate;
    long cost;
    long salvageValue;
    @NonNull
    DepreciationMethod method;
    int usefulLifeMonths;
    int decliningRateBps;
    UUID expenseAccountId;
    UUID accumulatedAccountId;
}
