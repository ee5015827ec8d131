package com.samt.configservice.exception;

/**
 * Exception thrown when a key is already taken, either by a live entry or by
 * a retired one that must be restored instead of re-created.
 * Maps to HTTP 409.
 */
public class ConfigAlreadyExistsException extends RuntimeException {

    public ConfigAlreadyExistsException(String key) {
        super("Configuration already exists: " + key);
    }

    public ConfigAlreadyExistsException(String key, boolean retired) {
        super(retired
            ? "Configuration key is retired: " + key + " (restore it instead of creating it again)"
            : "Configuration already exists: " + key);
    }
}
