package com.flagship.tenant_ledger.depreciation;

import com.flagship.tenant_ledger.ledger.JournalVoucher;
import lombok.Value;

/**
 * Outcome of disposing an asset. A positive gain is a gain on disposal,
 * a negative one a loss.
 */
@Value
public class AssetDisposal {
    FixedAsset asset;
    JournalVoucher voucher;
    long bookValue;
    long proceeds;
    long gain;
}
