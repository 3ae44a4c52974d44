package com.flagship.tenant_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JDBC access to ledger_entries.
 *
 * Entries are written once. The immutability trigger allows a single later
 * update: setting reconciliation_batch_id on an unreconciled entry.
 */
@Repository
@RequiredArgsConstructor
public class LedgerEntryRepository {

    private static final String COLUMNS = "id, tenant_id, voucher_id, line_number, account_id, transaction_date, " +
        "debit, credit, description, source_type, source_id, reconciliation_batch_id";

    private final JdbcTemplate jdbcTemplate;

    public void insertAll(List<LedgerEntry> entries) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO ledger_entries (id, tenant_id, voucher_id, line_number, account_id, transaction_date, " +
            "debit, credit, description, source_type, source_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entries,
            entries.size(),
            (ps, entry) -> {
                SourceDocumentRef source = entry.getSourceDocument();
                ps.setObject(1, entry.getId());
                ps.setObject(2, entry.getTenantId());
                ps.setObject(3, entry.getVoucherId());
                ps.setInt(4, entry.getLineNumber());
                ps.setObject(5, entry.getAccountId());
                ps.setObject(6, entry.getTransactionDate());
                ps.setLong(7, entry.getDebit());
                ps.setLong(8, entry.getCredit());
                ps.setString(9, entry.getDescription());
                ps.setString(10, source != null ? source.getType().name() : null);
                ps.setString(11, source != null ? source.getId() : null);
            });
    }

    public List<LedgerEntry> findByVoucher(UUID tenantId, UUID voucherId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_entries WHERE tenant_id = ? AND voucher_id = ? ORDER BY line_number",
            entryRowMapper(), tenantId, voucherId);
    }

    /**
     * Unreconciled entries of an account dated on or before the given date,
     * in chronological and voucher-sequence order.
     */
    public List<LedgerEntry> findUnreconciled(UUID tenantId, UUID accountId, LocalDate upTo) {
        return jdbcTemplate.query(
            "SELECT " + prefixed("e") + " FROM ledger_entries e " +
            "JOIN journal_vouchers v ON v.tenant_id = e.tenant_id AND v.id = e.voucher_id " +
            "WHERE e.tenant_id = ? AND e.account_id = ? AND e.reconciliation_batch_id IS NULL " +
            "AND e.transaction_date <= ? " +
            "ORDER BY e.transaction_date, v.sequence_number, e.line_number",
            entryRowMapper(), tenantId, accountId, upTo);
    }

    /**
     * Attaches entries to a reconciliation batch. Only entries that are still
     * unreconciled are touched; the returned count tells the caller whether
     * all of them were.
     */
    public int attachToBatch(UUID tenantId, UUID batchId, List<UUID> entryIds) {
        if (entryIds.isEmpty()) {
            return 0;
        }
        int[][] counts = jdbcTemplate.batchUpdate(
            "UPDATE ledger_entries SET reconciliation_batch_id = ?, reconciled_at = CURRENT_TIMESTAMP " +
            "WHERE tenant_id = ? AND id = ? AND reconciliation_batch_id IS NULL",
            entryIds,
            entryIds.size(),
            (ps, entryId) -> {
                ps.setObject(1, batchId);
                ps.setObject(2, tenantId);
                ps.setObject(3, entryId);
            });
        int updated = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                updated += count;
            }
        }
        return updated;
    }

    private static String prefixed(String alias) {
        return alias + "." + COLUMNS.replace(", ", ", " + alias + ".");
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            rs.getObject("voucher_id", UUID.class),
            rs.getInt("line_number"),
            rs.getObject("account_id", UUID.class),
            rs.getObject("transaction_date", LocalDate.class),
            rs.getLong("debit"),
            rs.getLong("credit"),
            rs.getString("description"),
            SourceDocumentRef.ofNullable(rs.getString("source_type"), rs.getString("source_id")),
            rs.getObject("reconciliation_batch_id", UUID.class)
        );
    }
}
