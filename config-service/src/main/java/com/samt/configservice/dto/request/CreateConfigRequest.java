package com.samt.configservice.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.ConfigKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating a configuration entry.
 * {@code value} is further checked against {@code validationSchema} when one is given.
 */
public record CreateConfigRequest(

    @NotBlank(message = "Key is required")
    @Size(min = 3, max = 100, message = "Key must be between 3-100 characters")
    @Pattern(regexp = "^[a-z0-9_]+$", message = "Key must only contain lowercase letters, digits and underscores")
    String key,

    @NotNull(message = "Value is required")
    JsonNode value,

    @NotNull(message = "Kind is required")
    ConfigKind kind,

    @NotBlank(message = "Category is required")
    @Size(min = 3, max = 50, message = "Category must be between 3-50 characters")
    String category,

    @Size(max = 500, message = "Description must not exceed 500 characters")
    String description,

    JsonNode validationSchema
) {}
