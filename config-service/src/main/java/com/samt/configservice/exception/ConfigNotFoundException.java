package com.samt.configservice.exception;

/**
 * Exception thrown when no active configuration exists for a key.
 * Maps to HTTP 404.
 */
public class ConfigNotFoundException extends RuntimeException {

    private final String key;

    public ConfigNotFoundException(String key) {
        super("Configuration not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
