package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.api.dto.OnboardTenantRequest;
import com.flagship.tenant_ledger.api.dto.TenantResponse;
import com.flagship.tenant_ledger.tenant.CurrencyCode;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantOnboardingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant onboarding and lifecycle. These endpoints are addressed by
 * identifier in the path, not by the X-Tenant-ID header, so a suspended
 * tenant can still be reactivated.
 */
@RestController
@RequestMapping("/api/tenants")
@RequiredArgsConstructor
@Slf4j
public class TenantController {

    private final TenantOnboardingService onboardingService;

    @PostMapping
    public ResponseEntity<TenantResponse> onboard(@Valid @RequestBody OnboardTenantRequest request) {
        CurrencyCode currency = null;
        if (request.getBaseCurrency() != null) {
            try {
                currency = CurrencyCode.valueOf(request.getBaseCurrency());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported currency: " + request.getBaseCurrency());
            }
        }
        int fiscalMonth = request.getFiscalYearStartMonth() != null ? request.getFiscalYearStartMonth() : 1;
        Tenant tenant = onboardingService.onboard(request.getIdentifier(), request.getBusinessName(),
            currency, fiscalMonth);
        return ResponseEntity.status(HttpStatus.CREATED).body(TenantResponse.from(tenant));
    }

    @PostMapping("/{identifier}/suspend")
    public TenantResponse suspend(@PathVariable("identifier") String identifier) {
        return TenantResponse.from(onboardingService.suspend(identifier));
    }

    @PostMapping("/{identifier}/activate")
    public TenantResponse activate(@PathVariable("identifier") String identifier) {
        return TenantResponse.from(onboardingService.activate(identifier));
    }
}
