package com.samt.configservice.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.ConfigKind;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of a configuration entry as committed in the store.
 * JSON documents are copied on construction and on every read, so a caller
 * mutating a returned node never alters the cached or published snapshot.
 */
@Builder
public record StoredEntry(
    UUID id,
    String key,
    JsonNode value,
    ConfigKind kind,
    String category,
    String description,
    JsonNode validationSchema,
    int version,
    boolean active,
    List<ChangeEvent> changeHistory,
    String createdBy,
    Instant createdAt,
    Instant updatedAt
) {

    public StoredEntry {
        value = value == null ? null : value.deepCopy();
        validationSchema = validationSchema == null ? null : validationSchema.deepCopy();
        changeHistory = changeHistory == null ? List.of() : List.copyOf(changeHistory);
    }

    @Override
    public JsonNode value() {
        return value == null ? null : value.deepCopy();
    }

    @Override
    public JsonNode validationSchema() {
        return validationSchema == null ? null : validationSchema.deepCopy();
    }
}
