package com.flagship.tenant_ledger.account;

import com.flagship.tenant_ledger.ledger.TenantLock;
import com.flagship.tenant_ledger.ledger.exception.AccountInUseException;
import com.flagship.tenant_ledger.ledger.exception.DuplicateAccountException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Chart-of-accounts registry for a tenant.
 *
 * Rules enforced here:
 * 1. Names are unique per tenant (case-insensitive), codes unique when given
 * 2. Accounts are soft-deactivated, never deleted
 * 3. System accounts cannot be deactivated or retyped
 * 4. An account with unreconciled entries cannot be deactivated
 * 5. An account referenced by any entry cannot change type
 *
 * Deactivation and retyping hold the tenant's ledger lock, so their entry
 * checks see every posting that committed before them and no posting can
 * land on the account until they commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsService {

    private final AccountRepository accountRepository;
    private final TenantLock tenantLock;

    @Transactional
    public Account createAccount(Tenant tenant, String name, AccountType type) {
        return createAccount(tenant, null, name, type);
    }

    @Transactional
    public Account createAccount(Tenant tenant, String code, String name, AccountType type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        String trimmedName = name.trim();
        String trimmedCode = code == null || code.isBlank() ? null : code.trim();

        if (accountRepository.existsByName(tenant.getId(), trimmedName)) {
            throw new DuplicateAccountException("name", trimmedName);
        }
        if (trimmedCode != null && accountRepository.existsByCode(tenant.getId(), trimmedCode)) {
            throw new DuplicateAccountException("code", trimmedCode);
        }

        Account account = new Account(UUID.randomUUID(), tenant.getId(), trimmedCode, trimmedName, type, null, true);
        try {
            accountRepository.insert(account);
        } catch (DuplicateKeyException e) {
            // lost a race against a concurrent insert of the same name or code
            throw new DuplicateAccountException("name or code", trimmedCode != null ? trimmedCode : trimmedName);
        }
        log.info("Created account: tenant={}, code={}, name={}, type={}",
            tenant.getIdentifier(), trimmedCode, trimmedName, type);
        return account;
    }

    @Transactional
    public Account deactivateAccount(Tenant tenant, UUID accountId) {
        tenantLock.acquire(tenant.getId());
        Account account = requireAccount(tenant, accountId);
        if (account.isSystem()) {
            throw new AccountInUseException(accountId, "system account " + account.getSystemRole());
        }
        if (accountRepository.hasUnreconciledEntries(tenant.getId(), accountId)) {
            throw new AccountInUseException(accountId, "unreconciled entries exist");
        }
        accountRepository.deactivate(tenant.getId(), accountId);
        log.info("Deactivated account: tenant={}, accountId={}", tenant.getIdentifier(), accountId);
        return new Account(account.getId(), account.getTenantId(), account.getCode(), account.getName(),
            account.getType(), account.getSystemRole(), false);
    }

    @Transactional
    public Account changeAccountType(Tenant tenant, UUID accountId, AccountType newType) {
        tenantLock.acquire(tenant.getId());
        Account account = requireAccount(tenant, accountId);
        if (account.isSystem()) {
            throw new AccountInUseException(accountId, "system account " + account.getSystemRole());
        }
        if (account.getType() == newType) {
            return account;
        }
        if (accountRepository.hasEntries(tenant.getId(), accountId)) {
            throw new AccountInUseException(accountId, "ledger entries reference it");
        }
        accountRepository.updateType(tenant.getId(), accountId, newType);
        return new Account(account.getId(), account.getTenantId(), account.getCode(), account.getName(),
            newType, account.getSystemRole(), account.isActive());
    }

    /**
     * Streams the tenant's accounts, optionally filtered by type.
     * The returned stream is lazy and must be closed.
     */
    public Stream<Account> listAccounts(Tenant tenant, AccountType typeFilter) {
        return accountRepository.streamByTenant(tenant.getId(), typeFilter);
    }

    /**
     * Looks up an account within the tenant. Another tenant's account id is
     * simply not found. Deactivated accounts are returned.
     */
    @Transactional(readOnly = true)
    public Optional<Account> findAccount(Tenant tenant, UUID accountId) {
        return accountRepository.findById(tenant.getId(), accountId);
    }

    @Transactional(readOnly = true)
    public Account requireAccount(Tenant tenant, UUID accountId) {
        return findAccount(tenant, accountId)
            .orElseThrow(() -> new UnknownAccountException(accountId));
    }

    @Transactional(readOnly = true)
    public Account requireSystemAccount(Tenant tenant, SystemAccount role) {
        return accountRepository.findBySystemRole(tenant.getId(), role)
            .orElseThrow(() -> new IllegalStateException(
                "Tenant " + tenant.getIdentifier() + " has no system account " + role));
    }

    @Transactional(readOnly = true)
    public Set<SystemAccount> findSystemRoles(Tenant tenant) {
        return accountRepository.findSystemRoles(tenant.getId());
    }

    /**
     * Inserts every {@link SystemAccount} for a freshly created tenant.
     * Must join the onboarding transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void seedSystemAccounts(Tenant tenant) {
        for (SystemAccount role : SystemAccount.values()) {
            accountRepository.insert(new Account(
                UUID.randomUUID(), tenant.getId(), role.getCode(), role.getDefaultName(), role.getType(), role, true));
        }
        log.debug("Seeded {} system accounts for tenant {}", SystemAccount.values().length, tenant.getIdentifier());
    }
}
