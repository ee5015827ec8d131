package com.samt.configservice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of configuration kinds.
 * Serialized in lower case on the wire, stored upper case in the database.
 */
public enum ConfigKind {
    CPA,
    SYSTEM,
    MLM,
    INTEGRATION,
    SECURITY,
    PERFORMANCE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the value names no kind
     */
    @JsonCreator
    public static ConfigKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Kind must not be null");
        }
        return Arrays.stream(values())
            .filter(kind -> kind.value().equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown kind '" + value + "', expected one of " + Arrays.toString(values()).toLowerCase(Locale.ROOT)));
    }
}
