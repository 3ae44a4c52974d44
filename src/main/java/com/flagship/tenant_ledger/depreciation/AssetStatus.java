package com.flagship.tenant_ledger.depreciation;

public enum AssetStatus {
    ACTIVE,
    FULLY_DEPRECIATED,
    DISPOSED
}
