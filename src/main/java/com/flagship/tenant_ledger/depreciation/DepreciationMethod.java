package com.flagship.tenant_ledger.depreciation;

public enum DepreciationMethod {
    /** (cost - salvage) / useful life, remainder absorbed by the final period. */
    STRAIGHT_LINE,
    /** A fixed rate applied to net book value each period, never below salvage. */
    DECLINING_BALANCE
}
