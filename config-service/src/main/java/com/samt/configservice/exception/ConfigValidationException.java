package com.samt.configservice.exception;

import com.samt.configservice.schema.FieldError;

import java.util.List;

/**
 * Exception thrown when a value does not satisfy its validation schema.
 * Maps to HTTP 400 VALIDATION_ERROR, carrying every failing field.
 */
public class ConfigValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public ConfigValidationException(String key, List<FieldError> errors) {
        super("Validation failed for " + key + ": " + errors.size() + " error(s)");
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}
