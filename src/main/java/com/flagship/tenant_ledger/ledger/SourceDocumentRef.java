package com.flagship.tenant_ledger.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * Reference from a ledger entry back to the business document that caused it.
 * Type and id always come together.
 */
@Value
public class SourceDocumentRef {
    SourceDocumentType type;
    String id;

    private SourceDocumentRef(SourceDocumentType type, String id) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(id, "id");
        if (id.isBlank() || id.length() > 64) {
            throw new IllegalArgumentException("Source document id must be 1-64 characters");
        }
    }

    public static SourceDocumentRef of(SourceDocumentType type, String id) {
        return new SourceDocumentRef(type, id);
    }

    /**
     * Rebuilds a reference from two nullable columns.
     */
    public static SourceDocumentRef ofNullable(String type, String id) {
        if (type == null || id == null) {
            return null;
        }
        return new SourceDocumentRef(SourceDocumentType.valueOf(type), id);
    }
}
