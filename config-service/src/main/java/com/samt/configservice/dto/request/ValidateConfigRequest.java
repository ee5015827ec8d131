package com.samt.configservice.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

public record ValidateConfigRequest(

    @NotNull(message = "Value is required")
    JsonNode value,

    @NotNull(message = "Validation schema is required")
    JsonNode validationSchema
) {}
