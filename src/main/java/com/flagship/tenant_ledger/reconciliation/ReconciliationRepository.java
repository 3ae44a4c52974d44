package com.flagship.tenant_ledger.reconciliation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class ReconciliationRepository {

    private static final String COLUMNS =
        "id, tenant_id, account_id, statement_date, closing_balance, matched_total, discrepancy, " +
        "entry_count, status, created_at";

    private final JdbcTemplate jdbcTemplate;

    public void insert(ReconciliationBatch batch) {
        jdbcTemplate.update(
            "INSERT INTO reconciliation_batches (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            batch.getId(),
            batch.getTenantId(),
            batch.getAccountId(),
            batch.getStatementDate(),
            batch.getClosingBalance(),
            batch.getMatchedTotal(),
            batch.getDiscrepancy(),
            batch.getEntryCount(),
            batch.getStatus().name(),
            Timestamp.from(batch.getCreatedAt())
        );
    }

    public Optional<ReconciliationBatch> findById(UUID tenantId, UUID batchId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM reconciliation_batches WHERE tenant_id = ? AND id = ?",
            batchRowMapper(), tenantId, batchId).stream().findFirst();
    }

    public List<ReconciliationBatch> findByAccount(UUID tenantId, UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM reconciliation_batches WHERE tenant_id = ? AND account_id = ? " +
            "ORDER BY created_at",
            batchRowMapper(), tenantId, accountId);
    }

    /**
     * Debit and credit totals of the account's entries already attached to a batch.
     */
    public long[] reconciledTotals(UUID tenantId, UUID accountId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0), COALESCE(SUM(credit), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND account_id = ? AND reconciliation_batch_id IS NOT NULL",
            (rs, rowNum) -> new long[]{rs.getLong(1), rs.getLong(2)},
            tenantId, accountId);
    }

    private RowMapper<ReconciliationBatch> batchRowMapper() {
        return (rs, rowNum) -> new ReconciliationBatch(
            rs.getObject("id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getObject("statement_date", java.time.LocalDate.class),
            rs.getLong("closing_balance"),
            rs.getLong("matched_total"),
            rs.getLong("discrepancy"),
            rs.getInt("entry_count"),
            ReconciliationStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
