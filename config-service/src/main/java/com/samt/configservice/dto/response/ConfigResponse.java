package com.samt.configservice.dto.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.store.StoredEntry;
import lombok.Builder;

import java.time.Instant;

/**
 * Response DTO for a configuration entry. History is served separately.
 */
@Builder
public record ConfigResponse(
    String key,
    JsonNode value,
    ConfigKind kind,
    String category,
    String description,
    JsonNode validationSchema,
    int version,
    boolean active,
    String createdBy,
    Instant createdAt,
    Instant updatedAt
) {

    public static ConfigResponse from(StoredEntry entry) {
        return ConfigResponse.builder()
            .key(entry.key())
            .value(entry.value())
            .kind(entry.kind())
            .category(entry.category())
            .description(entry.description())
            .validationSchema(entry.validationSchema())
            .version(entry.version())
            .active(entry.active())
            .createdBy(entry.createdBy())
            .createdAt(entry.createdAt())
            .updatedAt(entry.updatedAt())
            .build();
    }
}
