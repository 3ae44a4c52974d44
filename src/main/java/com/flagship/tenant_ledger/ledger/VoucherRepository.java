package com.flagship.tenant_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to journal_vouchers. Vouchers are insert-only; a database
 * trigger rejects updates and deletes.
 */
@Repository
@RequiredArgsConstructor
public class VoucherRepository {

    private static final String COLUMNS = "id, tenant_id, voucher_number, sequence_number, transaction_date, note, " +
        "origin, source_type, source_id, idempotency_key, posted_at";

    private final JdbcTemplate jdbcTemplate;

    public void insert(VoucherHeader voucher) {
        SourceDocumentRef source = voucher.getSourceDocument();
        jdbcTemplate.update(
            "INSERT INTO journal_vouchers (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            voucher.getId(),
            voucher.getTenantId(),
            voucher.getVoucherNumber(),
            voucher.getSequenceNumber(),
            voucher.getTransactionDate(),
            voucher.getNote(),
            voucher.getOrigin().name(),
            source != null ? source.getType().name() : null,
            source != null ? source.getId() : null,
            voucher.getIdempotencyKey(),
            Timestamp.from(voucher.getPostedAt())
        );
    }

    public Optional<VoucherHeader> findByNumber(UUID tenantId, String voucherNumber) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM journal_vouchers WHERE tenant_id = ? AND voucher_number = ?",
            headerRowMapper(), tenantId, voucherNumber).stream().findFirst();
    }

    public Optional<VoucherHeader> findById(UUID tenantId, UUID voucherId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM journal_vouchers WHERE tenant_id = ? AND id = ?",
            headerRowMapper(), tenantId, voucherId).stream().findFirst();
    }

    public Optional<VoucherHeader> findByIdempotencyKey(UUID tenantId, String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM journal_vouchers WHERE tenant_id = ? AND idempotency_key = ?",
            headerRowMapper(), tenantId, idempotencyKey).stream().findFirst();
    }

    public List<VoucherHeader> findByDateRange(UUID tenantId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM journal_vouchers " +
            "WHERE tenant_id = ? AND transaction_date BETWEEN ? AND ? " +
            "ORDER BY transaction_date, sequence_number",
            headerRowMapper(), tenantId, from, to);
    }

    private RowMapper<VoucherHeader> headerRowMapper() {
        return (rs, rowNum) -> new VoucherHeader(
            rs.getObject("id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            rs.getString("voucher_number"),
            rs.getLong("sequence_number"),
            rs.getObject("transaction_date", LocalDate.class),
            rs.getString("note"),
            OriginModule.valueOf(rs.getString("origin")),
            SourceDocumentRef.ofNullable(rs.getString("source_type"), rs.getString("source_id")),
            rs.getString("idempotency_key"),
            rs.getTimestamp("posted_at").toInstant()
        );
    }
}
