package com.samt.configservice.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Compiled form of a shape description. Stateless and safe to share between threads.
 */
@FunctionalInterface
public interface Validator {

    ValidationResult validate(JsonNode value);
}
