package com.samt.configservice.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of validating a value: either the normalized value or the list of errors.
 */
public record ValidationResult(boolean valid, JsonNode normalizedValue, List<FieldError> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult valid(JsonNode normalizedValue) {
        return new ValidationResult(true, normalizedValue, List.of());
    }

    public static ValidationResult invalid(List<FieldError> errors) {
        return new ValidationResult(false, null, errors);
    }
}
