package com.flagship.tenant_ledger.document;

import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import com.flagship.tenant_ledger.ledger.exception.DuplicateDocumentException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Default {@link SourceDocumentStore} backed by the source_documents table.
 */
@Repository
@RequiredArgsConstructor
public class JdbcSourceDocumentStore implements SourceDocumentStore {

    private static final String COLUMNS =
        "tenant_id, document_type, document_id, counterparty, document_date, due_date, total";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void register(SourceDocument document) {
        if (document.getDueDate().isBefore(document.getDocumentDate())) {
            throw new IllegalArgumentException("Due date precedes document date for " + document.getDocumentId());
        }
        int inserted = jdbcTemplate.update(
            "INSERT INTO source_documents (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (tenant_id, document_type, document_id) DO NOTHING",
            document.getTenantId(),
            document.getType().name(),
            document.getDocumentId(),
            document.getCounterparty(),
            document.getDocumentDate(),
            document.getDueDate(),
            document.getTotal()
        );
        if (inserted == 0) {
            throw new DuplicateDocumentException(document.getType(), document.getDocumentId());
        }
    }

    @Override
    public Optional<SourceDocument> find(UUID tenantId, SourceDocumentType type, String documentId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM source_documents " +
            "WHERE tenant_id = ? AND document_type = ? AND document_id = ?",
            documentRowMapper(), tenantId, type.name(), documentId).stream().findFirst();
    }

    @Override
    public List<SourceDocument> findIssuedOnOrBefore(UUID tenantId, SourceDocumentType type, LocalDate asOf) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM source_documents " +
            "WHERE tenant_id = ? AND document_type = ? AND document_date <= ? " +
            "ORDER BY due_date, document_id",
            documentRowMapper(), tenantId, type.name(), asOf);
    }

    private RowMapper<SourceDocument> documentRowMapper() {
        return (rs, rowNum) -> SourceDocument.builder()
            .tenantId(rs.getObject("tenant_id", UUID.class))
            .type(SourceDocumentType.valueOf(rs.getString("document_type")))
            .documentId(rs.getString("document_id"))
            .counterparty(rs.getString("counterparty"))
            .documentDate(rs.getObject("document_date", LocalDate.class))
            .dueDate(rs.getObject("due_date", LocalDate.class))
            .total(rs.getLong("total"))
            .build();
    }
}
