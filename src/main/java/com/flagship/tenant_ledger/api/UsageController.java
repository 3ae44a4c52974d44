package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import com.flagship.tenant_ledger.usage.UsageQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final TenantResolver tenantResolver;
    private final UsageQueryService usageQueryService;

    @GetMapping("/postings")
    public Map<String, Object> postingCount(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("month") YearMonth month) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("month", month.toString());
        response.put("posting_count", usageQueryService.postingCount(tenant, month));
        return response;
    }

    @GetMapping("/vouchers")
    public Map<OriginModule, Long> voucherCounts(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return usageQueryService.voucherCounts(tenant, from, to);
    }
}
