package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.api.dto.CorrectionRequest;
import com.flagship.tenant_ledger.api.dto.ReconcileRequest;
import com.flagship.tenant_ledger.api.dto.ReconciliationResponse;
import com.flagship.tenant_ledger.api.dto.VoucherResponse;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.reconciliation.ReconciliationResult;
import com.flagship.tenant_ledger.reconciliation.ReconciliationService;
import com.flagship.tenant_ledger.reconciliation.StatementSnapshot;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/accounts/{accountId}")
@RequiredArgsConstructor
public class ReconciliationController {

    private final TenantResolver tenantResolver;
    private final ReconciliationService reconciliationService;

    @PostMapping("/reconciliations")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody ReconcileRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        ReconciliationResult result = reconciliationService.reconcile(tenant, accountId,
            new StatementSnapshot(request.getStatementDate(), Money.toMinorUnits(request.getClosingBalance())));
        return ResponseEntity.status(HttpStatus.CREATED).body(ReconciliationResponse.from(result));
    }

    @PostMapping("/reconciliation-corrections")
    public ResponseEntity<VoucherResponse> postCorrection(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody CorrectionRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return ResponseEntity.status(HttpStatus.CREATED).body(VoucherResponse.from(
            reconciliationService.postCorrection(tenant, accountId, request.getOffsetAccountId(),
                Money.toMinorUnits(request.getAmount()), request.getTransactionDate(), request.getNote())));
    }
}
