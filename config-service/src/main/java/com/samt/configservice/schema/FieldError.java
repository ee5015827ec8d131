package com.samt.configservice.schema;

/**
 * One failing leaf of a validated value.
 *
 * @param path dotted path to the value ("" for the root, "groups.0.operator" for nested)
 */
public record FieldError(String path, String message) {
}
