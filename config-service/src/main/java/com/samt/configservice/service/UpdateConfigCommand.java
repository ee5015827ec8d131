package com.samt.configservice.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

/**
 * @param description replaces the stored description when non-null
 * @param validationSchema replaces the stored schema when non-null, and is used to validate {@code value}
 */
@Builder
public record UpdateConfigCommand(
    JsonNode value,
    String description,
    JsonNode validationSchema,
    String actor
) {
}
