package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregation queries behind the financial statements.
 *
 * Uses its own JdbcTemplate so that derivation queries carry a statement
 * timeout ({@code ledger.statements.query-timeout-seconds}) without affecting
 * posting. It still joins the caller's transaction, since both templates share
 * the DataSource.
 */
@Repository
public class StatementQueries {

    private static final String TOTALS_SELECT =
        "SELECT a.id, a.code, a.name, a.account_type, a.system_role, " +
        "COALESCE(SUM(e.debit), 0) AS total_debit, COALESCE(SUM(e.credit), 0) AS total_credit " +
        "FROM accounts a JOIN ledger_entries e ON e.tenant_id = a.tenant_id AND e.account_id = a.id ";

    private static final String TOTALS_GROUP =
        "GROUP BY a.id, a.code, a.name, a.account_type, a.system_role ORDER BY a.code NULLS LAST, a.name";

    private final JdbcTemplate jdbcTemplate;

    public StatementQueries(DataSource dataSource,
                            @Value("${ledger.statements.query-timeout-seconds:30}") int queryTimeoutSeconds) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
    }

    /**
     * Cumulative totals per account for every entry dated on or before asOf.
     * Accounts without entries are omitted.
     */
    public List<AccountTotals> totalsAsOf(UUID tenantId, LocalDate asOf) {
        return jdbcTemplate.query(
            TOTALS_SELECT + "WHERE a.tenant_id = ? AND e.transaction_date <= ? " + TOTALS_GROUP,
            totalsRowMapper(), tenantId, asOf);
    }

    /**
     * Movements per account for entries dated within [from, to].
     */
    public List<AccountTotals> movementsBetween(UUID tenantId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            TOTALS_SELECT + "WHERE a.tenant_id = ? AND e.transaction_date BETWEEN ? AND ? " + TOTALS_GROUP,
            totalsRowMapper(), tenantId, from, to);
    }

    /**
     * Net debit (debits minus credits) of one account, per source document of
     * the given type, over entries dated on or before asOf.
     */
    public Map<String, Long> netDebitBySource(UUID tenantId, UUID accountId,
                                              SourceDocumentType sourceType, LocalDate asOf) {
        Map<String, Long> result = new HashMap<>();
        jdbcTemplate.query(
            "SELECT source_id, SUM(debit) - SUM(credit) AS net FROM ledger_entries " +
            "WHERE tenant_id = ? AND account_id = ? AND source_type = ? AND transaction_date <= ? " +
            "GROUP BY source_id",
            rs -> {
                result.put(rs.getString("source_id"), rs.getLong("net"));
            },
            tenantId, accountId, sourceType.name(), asOf);
        return result;
    }

    /**
     * Totals of one account over entries dated strictly before the given date.
     */
    public long[] totalsBefore(UUID tenantId, UUID accountId, LocalDate before) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS d, COALESCE(SUM(credit), 0) AS c FROM ledger_entries " +
            "WHERE tenant_id = ? AND account_id = ? AND transaction_date < ?",
            (rs, rowNum) -> new long[] {rs.getLong("d"), rs.getLong("c")},
            tenantId, accountId, before);
    }

    /**
     * Net debit of the given accounts over entries dated strictly before a date.
     */
    public long netDebitBefore(UUID tenantId, Collection<UUID> accountIds, LocalDate before) {
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        args.addAll(accountIds);
        args.add(before);
        Long net = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit - credit), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND account_id IN (" + placeholders(accountIds.size()) + ") " +
            "AND transaction_date < ?",
            Long.class, args.toArray());
        return net != null ? net : 0L;
    }

    /**
     * Inflows and outflows of the given accounts within [from, to], per origin.
     * Each voucher counts once with its net effect on the accounts, so a
     * voucher moving money between two of them contributes nothing.
     */
    public List<CashFlowStatement.Activity> cashActivityBetween(UUID tenantId, Collection<UUID> accountIds,
                                                                LocalDate from, LocalDate to) {
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        args.addAll(accountIds);
        args.add(from);
        args.add(to);
        return jdbcTemplate.query(
            "SELECT v.origin, " +
            "COALESCE(SUM(CASE WHEN n.net > 0 THEN n.net ELSE 0 END), 0) AS inflows, " +
            "COALESCE(SUM(CASE WHEN n.net < 0 THEN -n.net ELSE 0 END), 0) AS outflows " +
            "FROM (SELECT e.tenant_id, e.voucher_id, SUM(e.debit - e.credit) AS net FROM ledger_entries e " +
            "      WHERE e.tenant_id = ? AND e.account_id IN (" + placeholders(accountIds.size()) + ") " +
            "      AND e.transaction_date BETWEEN ? AND ? GROUP BY e.tenant_id, e.voucher_id) n " +
            "JOIN journal_vouchers v ON v.tenant_id = n.tenant_id AND v.id = n.voucher_id " +
            "WHERE n.net <> 0 GROUP BY v.origin ORDER BY v.origin",
            (rs, rowNum) -> new CashFlowStatement.Activity(
                OriginModule.valueOf(rs.getString("origin")),
                rs.getLong("inflows"),
                rs.getLong("outflows")),
            args.toArray());
    }

    public List<AccountLedger.Line> entriesBetween(UUID tenantId, UUID accountId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT e.id, v.voucher_number, e.transaction_date, e.description, e.debit, e.credit, " +
            "e.reconciliation_batch_id IS NOT NULL AS reconciled " +
            "FROM ledger_entries e JOIN journal_vouchers v ON v.tenant_id = e.tenant_id AND v.id = e.voucher_id " +
            "WHERE e.tenant_id = ? AND e.account_id = ? AND e.transaction_date BETWEEN ? AND ? " +
            "ORDER BY e.transaction_date, v.sequence_number, e.line_number",
            (rs, rowNum) -> new AccountLedger.Line(
                rs.getObject("id", UUID.class),
                rs.getString("voucher_number"),
                rs.getObject("transaction_date", LocalDate.class),
                rs.getString("description"),
                rs.getLong("debit"),
                rs.getLong("credit"),
                rs.getBoolean("reconciled"),
                0L),
            tenantId, accountId, from, to);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private RowMapper<AccountTotals> totalsRowMapper() {
        return (rs, rowNum) -> {
            String role = rs.getString("system_role");
            return new AccountTotals(
                rs.getObject("id", UUID.class),
                rs.getString("code"),
                rs.getString("name"),
                AccountType.valueOf(rs.getString("account_type")),
                role != null ? SystemAccount.valueOf(role) : null,
                rs.getLong("total_debit"),
                rs.getLong("total_credit")
            );
        };
    }
}
