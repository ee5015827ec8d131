package com.samt.common.events;

/**
 * Kind of mutation carried by a {@link ConfigChangedEvent} and recorded in
 * the change history of a configuration entry.
 */
public enum ChangeAction {
    CREATE,
    UPDATE,
    DELETE,
    RESTORE
}
