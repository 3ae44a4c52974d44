package com.flagship.tenant_ledger.ledger.exception;

import java.util.UUID;

public class AssetNotFoundException extends LedgerException {

    public AssetNotFoundException(UUID assetId) {
        super("ASSET_NOT_FOUND", "Fixed asset not found: " + assetId);
    }
}
