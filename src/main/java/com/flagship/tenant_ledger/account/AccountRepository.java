package com.flagship.tenant_ledger.account;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * JDBC access to the accounts table. Every query is scoped by tenant_id, so
 * an id from another tenant behaves exactly like a missing id.
 */
@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private static final String COLUMNS = "id, tenant_id, code, name, account_type, system_role, is_active";

    private final JdbcTemplate jdbcTemplate;

    public void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, tenant_id, code, name, account_type, system_role, is_system, is_active) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getTenantId(),
            account.getCode(),
            account.getName(),
            account.getType().name(),
            account.getSystemRole() != null ? account.getSystemRole().name() : null,
            account.isSystem(),
            account.isActive()
        );
    }

    public Optional<Account> findById(UUID tenantId, UUID accountId) {
        List<Account> found = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND id = ?",
            accountRowMapper(), tenantId, accountId);
        return found.stream().findFirst();
    }

    public Optional<Account> findBySystemRole(UUID tenantId, SystemAccount role) {
        List<Account> found = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND system_role = ?",
            accountRowMapper(), tenantId, role.name());
        return found.stream().findFirst();
    }

    public Set<SystemAccount> findSystemRoles(UUID tenantId) {
        List<String> roles = jdbcTemplate.queryForList(
            "SELECT system_role FROM accounts WHERE tenant_id = ? AND system_role IS NOT NULL",
            String.class, tenantId);
        Set<SystemAccount> result = new HashSet<>();
        roles.forEach(role -> result.add(SystemAccount.valueOf(role)));
        return result;
    }

    /**
     * Lazily streams the tenant's accounts ordered by code then name.
     * The stream holds a database cursor and must be closed by the caller.
     */
    public Stream<Account> streamByTenant(UUID tenantId, AccountType typeFilter) {
        if (typeFilter == null) {
            return jdbcTemplate.queryForStream(
                "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? ORDER BY code NULLS LAST, name",
                accountRowMapper(), tenantId);
        }
        return jdbcTemplate.queryForStream(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND account_type = ? " +
            "ORDER BY code NULLS LAST, name",
            accountRowMapper(), tenantId, typeFilter.name());
    }

    public List<Account> findAllByTenant(UUID tenantId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? ORDER BY code NULLS LAST, name",
            accountRowMapper(), tenantId);
    }

    /**
     * Returns the subset of the given ids that are active accounts of this tenant.
     */
    public Set<UUID> findActiveIds(UUID tenantId, Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return Set.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(accountIds.size(), "?"));
        List<Object> args = new ArrayList<>(accountIds.size() + 1);
        args.add(tenantId);
        args.addAll(accountIds);
        List<UUID> found = jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE tenant_id = ? AND is_active AND id IN (" + placeholders + ")",
            UUID.class, args.toArray());
        return new HashSet<>(found);
    }

    public boolean existsByName(UUID tenantId, String name) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM accounts WHERE tenant_id = ? AND LOWER(name) = LOWER(?))",
            Boolean.class, tenantId, name);
        return Boolean.TRUE.equals(exists);
    }

    public boolean existsByCode(UUID tenantId, String code) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM accounts WHERE tenant_id = ? AND code = ?)",
            Boolean.class, tenantId, code);
        return Boolean.TRUE.equals(exists);
    }

    public boolean hasEntries(UUID tenantId, UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM ledger_entries WHERE tenant_id = ? AND account_id = ?)",
            Boolean.class, tenantId, accountId);
        return Boolean.TRUE.equals(exists);
    }

    public boolean hasUnreconciledEntries(UUID tenantId, UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM ledger_entries " +
            "WHERE tenant_id = ? AND account_id = ? AND reconciliation_batch_id IS NULL)",
            Boolean.class, tenantId, accountId);
        return Boolean.TRUE.equals(exists);
    }

    public int deactivate(UUID tenantId, UUID accountId) {
        return jdbcTemplate.update(
            "UPDATE accounts SET is_active = FALSE WHERE tenant_id = ? AND id = ?",
            tenantId, accountId);
    }

    public int updateType(UUID tenantId, UUID accountId, AccountType type) {
        return jdbcTemplate.update(
            "UPDATE accounts SET account_type = ? WHERE tenant_id = ? AND id = ?",
            type.name(), tenantId, accountId);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            String role = rs.getString("system_role");
            return new Account(
                rs.getObject("id", UUID.class),
                rs.getObject("tenant_id", UUID.class),
                rs.getString("code"),
                rs.getString("name"),
                AccountType.valueOf(rs.getString("account_type")),
                role != null ? SystemAccount.valueOf(role) : null,
                rs.getBoolean("is_active")
            );
        };
    }
}
