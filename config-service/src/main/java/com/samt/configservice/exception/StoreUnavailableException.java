package com.samt.configservice.exception;

/**
 * Exception thrown when the backing store cannot be reached or a store call
 * exceeds its transaction or lock timeout.
 * Maps to HTTP 503.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Config store unavailable during " + operation + ": " + cause.getMessage(), cause);
    }
}
