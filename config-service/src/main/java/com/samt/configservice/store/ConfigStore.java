package com.samt.configservice.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.exception.ConfigAlreadyExistsException;
import com.samt.configservice.exception.ConfigNotFoundException;
import com.samt.configservice.exception.ConflictException;
import com.samt.configservice.exception.StoreUnavailableException;

import java.util.List;
import java.util.Optional;

/**
 * Durable, versioned storage of configuration entries and their change history.
 *
 * Every method runs in its own bounded transaction; timeouts and connectivity
 * failures surface as {@link StoreUnavailableException}.
 */
public interface ConfigStore {

    /**
     * Persist a new entry at version 1 with a CREATE event.
     *
     * @throws ConfigAlreadyExistsException if the key exists, active or retired
     */
    StoredEntry create(NewEntry entry);

    Optional<StoredEntry> get(String key);

    List<StoredEntry> getByCategory(String category);

    List<StoredEntry> getByKind(ConfigKind kind);

    /**
     * All active entries ordered by category, then key.
     */
    List<StoredEntry> getAll();

    /**
     * Replace the value under a row lock, bumping the version by one.
     * Description and schema are only replaced when non-null.
     *
     * @throws ConfigNotFoundException if no active entry exists
     */
    StoredEntry update(String key, JsonNode newValue, String newDescription, JsonNode newSchema, String actor);

    /**
     * Soft delete. Version is unchanged.
     *
     * @throws ConfigNotFoundException if no active entry exists
     */
    StoredEntry delete(String key, String actor);

    /**
     * Reactivate a retired entry. Version is unchanged.
     *
     * @throws ConfigNotFoundException if the key was never created
     * @throws ConflictException if the entry is already active
     */
    StoredEntry restore(String key, String actor);

    /**
     * Change log of the key, active or retired; empty when unknown.
     */
    List<ChangeEvent> getHistory(String key);

    void ping();
}
