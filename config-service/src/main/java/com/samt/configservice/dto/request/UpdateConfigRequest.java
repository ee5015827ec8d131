package com.samt.configservice.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for updating a configuration value.
 * Omitted description and schema keep their stored values.
 */
public record UpdateConfigRequest(

    @NotNull(message = "Value is required")
    JsonNode value,

    @Size(max = 500, message = "Description must not exceed 500 characters")
    String description,

    JsonNode validationSchema
) {}
