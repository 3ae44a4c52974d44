package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.api.dto.AccountResponse;
import com.flagship.tenant_ledger.api.dto.ChangeAccountTypeRequest;
import com.flagship.tenant_ledger.api.dto.CreateAccountRequest;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final TenantResolver tenantResolver;
    private final ChartOfAccountsService chartOfAccounts;

    @PostMapping
    public ResponseEntity<AccountResponse> create(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @Valid @RequestBody CreateAccountRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(
            chartOfAccounts.createAccount(tenant, request.getCode(), request.getName(), request.getType())));
    }

    @GetMapping
    public List<AccountResponse> list(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam(name = "type", required = false) AccountType type) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        try (Stream<Account> accounts = chartOfAccounts.listAccounts(tenant, type)) {
            return accounts.map(AccountResponse::from).toList();
        }
    }

    @GetMapping("/{id}")
    public AccountResponse get(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("id") UUID id) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return AccountResponse.from(chartOfAccounts.requireAccount(tenant, id));
    }

    @PostMapping("/{id}/deactivate")
    public AccountResponse deactivate(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("id") UUID id) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return AccountResponse.from(chartOfAccounts.deactivateAccount(tenant, id));
    }

    @PutMapping("/{id}/type")
    public AccountResponse changeType(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody ChangeAccountTypeRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return AccountResponse.from(chartOfAccounts.changeAccountType(tenant, id, request.getType()));
    }
}
