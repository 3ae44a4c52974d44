package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.depreciation.AssetDisposal;
import com.flagship.tenant_ledger.ledger.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class AssetDisposalResponse {

    @JsonProperty("asset")
    AssetResponse asset;

    @JsonProperty("voucher")
    VoucherResponse voucher;

    @JsonProperty("book_value")
    BigDecimal bookValue;

    @JsonProperty("proceeds")
    BigDecimal proceeds;

    @JsonProperty("gain_or_loss")
    BigDecimal gainOrLoss;

    public static AssetDisposalResponse from(AssetDisposal disposal) {
        return AssetDisposalResponse.builder()
            .asset(AssetResponse.from(disposal.getAsset()))
            .voucher(VoucherResponse.from(disposal.getVoucher()))
            .bookValue(Money.toDecimal(disposal.getBookValue()))
            .proceeds(Money.toDecimal(disposal.getProceeds()))
            .gainOrLoss(Money.toDecimal(disposal.getGain()))
            .build();
    }
}
