package com.samt.configservice.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.common.events.ChangeAction;

import java.time.Instant;

/**
 * One audit record of an entry's change log.
 *
 * @param oldValue value before the change, null for CREATE and RESTORE
 * @param newValue value after the change, null for DELETE
 */
public record ChangeEvent(
    ChangeAction action,
    JsonNode oldValue,
    JsonNode newValue,
    String changedBy,
    Instant changedAt
) {

    public ChangeEvent {
        oldValue = oldValue == null || oldValue.isNull() ? null : oldValue;
        newValue = newValue == null || newValue.isNull() ? null : newValue;
    }
}
