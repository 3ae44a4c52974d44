package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.api.dto.AssetDisposalResponse;
import com.flagship.tenant_ledger.api.dto.AssetResponse;
import com.flagship.tenant_ledger.api.dto.DisposeAssetRequest;
import com.flagship.tenant_ledger.api.dto.RegisterAssetRequest;
import com.flagship.tenant_ledger.api.dto.VoucherResponse;
import com.flagship.tenant_ledger.depreciation.AssetDisposal;
import com.flagship.tenant_ledger.depreciation.AssetRegistration;
import com.flagship.tenant_ledger.depreciation.DepreciationScheduler;
import com.flagship.tenant_ledger.depreciation.DepreciationService;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/fixed-assets")
@RequiredArgsConstructor
public class AssetController {

    private final TenantResolver tenantResolver;
    private final DepreciationService depreciationService;
    private final DepreciationScheduler depreciationScheduler;

    @PostMapping
    public ResponseEntity<AssetResponse> register(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @Valid @RequestBody RegisterAssetRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        AssetRegistration registration = AssetRegistration.builder()
            .assetNumber(request.getAssetNumber())
            .name(request.getName())
            .acquisitionDate(request.getAcquisitionDate())
            .cost(Money.toMinorUnits(request.getCost()))
            .salvageValue(request.getSalvageValue() != null ? Money.toMinorUnits(request.getSalvageValue()) : 0L)
            .method(request.getMethod())
            .usefulLifeMonths(request.getUsefulLifeMonths())
            .decliningRateBps(request.getDecliningRateBps())
            .expenseAccountId(request.getExpenseAccountId())
            .accumulatedAccountId(request.getAccumulatedAccountId())
            .build();
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AssetResponse.from(depreciationService.registerAsset(tenant, registration)));
    }

    @GetMapping("/{id}")
    public AssetResponse get(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("id") UUID id) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return AssetResponse.from(depreciationService.findAsset(tenant, id));
    }

    /**
     * Posts one period. 201 with the voucher, or 204 when the period was
     * already posted or nothing is due.
     */
    @PostMapping("/{id}/depreciation")
    public ResponseEntity<VoucherResponse> depreciate(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("id") UUID id,
            @RequestParam("period") YearMonth period) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return depreciationService.runDepreciation(tenant, id, period)
            .map(voucher -> ResponseEntity.status(HttpStatus.CREATED).body(VoucherResponse.from(voucher)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/depreciation-runs")
    public Map<String, Object> runDue(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("up_to") YearMonth upTo) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        int posted = depreciationScheduler.runDueDepreciation(tenant, upTo);
        return Map.of("up_to", upTo.toString(), "vouchers_posted", posted);
    }

    @PostMapping("/{id}/disposal")
    public ResponseEntity<AssetDisposalResponse> dispose(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody DisposeAssetRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        AssetDisposal disposal = depreciationService.disposeAsset(tenant, id, request.getDisposalDate(),
            Money.toMinorUnits(request.getProceeds()), request.getProceedsAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(AssetDisposalResponse.from(disposal));
    }
}
