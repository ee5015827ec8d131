package com.samt.configservice.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.ConfigKind;
import lombok.Builder;

@Builder
public record CreateConfigCommand(
    String key,
    JsonNode value,
    ConfigKind kind,
    String category,
    String description,
    JsonNode validationSchema,
    String actor
) {
}
