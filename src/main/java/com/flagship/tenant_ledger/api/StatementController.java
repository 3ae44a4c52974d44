package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.api.dto.AccountLedgerResponse;
import com.flagship.tenant_ledger.api.dto.AgingReportResponse;
import com.flagship.tenant_ledger.api.dto.BalanceSheetResponse;
import com.flagship.tenant_ledger.api.dto.CashFlowResponse;
import com.flagship.tenant_ledger.api.dto.ProfitAndLossResponse;
import com.flagship.tenant_ledger.api.dto.TrialBalanceResponse;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.statement.AgingKind;
import com.flagship.tenant_ledger.statement.StatementService;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only financial statements. Amounts are decimal major units.
 */
@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
public class StatementController {

    private final TenantResolver tenantResolver;
    private final StatementService statementService;

    @GetMapping("/trial-balance")
    public TrialBalanceResponse trialBalance(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("as_of") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return TrialBalanceResponse.from(statementService.trialBalance(tenant, asOf));
    }

    @GetMapping("/profit-and-loss")
    public ProfitAndLossResponse profitAndLoss(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return ProfitAndLossResponse.from(statementService.profitAndLoss(tenant, from, to));
    }

    @GetMapping("/balance-sheet")
    public BalanceSheetResponse balanceSheet(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("as_of") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return BalanceSheetResponse.from(statementService.balanceSheet(tenant, asOf));
    }

    /**
     * Cash flow over the Cash and Bank accounts, or over the given
     * {@code account_id} values when any are passed.
     */
    @GetMapping("/cash-flow")
    public CashFlowResponse cashFlow(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "account_id", required = false) List<UUID> accountIds) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        if (accountIds == null || accountIds.isEmpty()) {
            return CashFlowResponse.from(statementService.cashFlow(tenant, from, to));
        }
        return CashFlowResponse.from(statementService.cashFlow(tenant, from, to, accountIds));
    }

    @GetMapping("/aging")
    public AgingReportResponse aging(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("as_of") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @RequestParam("kind") AgingKind kind) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return AgingReportResponse.from(statementService.agingReport(tenant, asOf, kind));
    }

    @GetMapping("/accounts/{accountId}/ledger")
    public AccountLedgerResponse accountLedger(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("accountId") UUID accountId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return AccountLedgerResponse.from(statementService.accountLedger(tenant, accountId, from, to));
    }

    @GetMapping("/accounts/{accountId}/balance")
    public Map<String, Object> accountBalance(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("accountId") UUID accountId,
            @RequestParam("as_of") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        BigDecimal balance = Money.toDecimal(statementService.accountBalance(tenant, accountId, asOf));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("account_id", accountId);
        response.put("as_of", asOf);
        response.put("balance", balance);
        return response;
    }
}
