package com.samt.configservice.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.ConfigKind;
import lombok.Builder;

/**
 * Already validated input of {@link ConfigStore#create(NewEntry)}.
 */
@Builder
public record NewEntry(
    String key,
    JsonNode value,
    ConfigKind kind,
    String category,
    String description,
    JsonNode validationSchema,
    String createdBy
) {
}
