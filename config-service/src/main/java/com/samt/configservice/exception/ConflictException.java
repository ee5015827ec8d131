package com.samt.configservice.exception;

/**
 * Exception thrown when an operation does not fit the entry's current state.
 * Maps to HTTP 409.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
