package com.samt.configservice.exception;

/**
 * Thrown when a validation schema is malformed and cannot be compiled.
 * Never reaches clients directly: it is reported as a validation error on path "schema".
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }
}
