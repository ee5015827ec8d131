package com.samt.configservice.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.samt.common.events.ChangeAction;
import com.samt.configservice.cache.ConfigCache;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.exception.ConfigNotFoundException;
import com.samt.configservice.exception.ConfigValidationException;
import com.samt.configservice.exception.SchemaException;
import com.samt.configservice.exception.StoreUnavailableException;
import com.samt.configservice.notify.ChangeBus;
import com.samt.configservice.schema.FieldError;
import com.samt.configservice.schema.SchemaCompiler;
import com.samt.configservice.schema.ValidationResult;
import com.samt.configservice.store.ChangeEvent;
import com.samt.configservice.store.ConfigStore;
import com.samt.configservice.store.NewEntry;
import com.samt.configservice.store.StoredEntry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Orchestrates configuration reads and writes.
 *
 * Write path (create/update/delete/restore), all under the per-key lock:
 * 1. Validate the value against its schema (update/create only); failure aborts before persistence
 * 2. Commit through {@link ConfigStore}
 * 3. Invalidate the cache entry
 * 4. Enqueue the change notification
 *
 * Holding the key lock across all four steps makes notifications of one key
 * follow commit order, and keeps a concurrent cache-miss load from caching a
 * value older than the last commit.
 *
 * Reads go through the cache and are retried ({@code storeRead} retry) when the
 * store is unavailable. Writes are never retried.
 */
@Service
@Slf4j
public class ConfigEngine {

    private static final String READ_RETRY = "storeRead";

    private final SchemaCompiler schemaCompiler;
    private final ConfigStore store;
    private final ConfigCache cache;
    private final ChangeBus changeBus;
    private final Retry readRetry;
    private final Duration cacheTtl;
    private final KeyedLock keyedLock = new KeyedLock();

    public ConfigEngine(
            SchemaCompiler schemaCompiler,
            ConfigStore store,
            ConfigCache cache,
            ChangeBus changeBus,
            RetryRegistry retryRegistry,
            @Value("${config.cache.ttl-seconds:3600}") long cacheTtlSeconds) {
        this.schemaCompiler = schemaCompiler;
        this.store = store;
        this.cache = cache;
        this.changeBus = changeBus;
        this.readRetry = retryRegistry.retry(READ_RETRY);
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
    }

    public StoredEntry createConfig(CreateConfigCommand command) {
        log.info("Creating config {} (kind={}, category={}) by {}",
            command.key(), command.kind(), command.category(), command.actor());

        JsonNode value = validateOrThrow(command.key(), command.value(), command.validationSchema());

        return keyedLock.withLock(command.key(), () -> {
            StoredEntry created = store.create(NewEntry.builder()
                .key(command.key())
                .value(value)
                .kind(command.kind())
                .category(command.category())
                .description(command.description())
                .validationSchema(command.validationSchema())
                .createdBy(command.actor())
                .build());
            cache.invalidate(created.key());
            changeBus.publish(created.key(), created.value(), ChangeAction.CREATE);

            log.info("Config {} created at version {}", created.key(), created.version());
            return created;
        });
    }

    /**
     * @throws ConfigNotFoundException if no active entry exists
     */
    public StoredEntry getConfig(String key) {
        Optional<StoredEntry> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            return cached.get();
        }

        return keyedLock.withLock(key, () -> {
            Optional<StoredEntry> loadedMeanwhile = cache.get(key);
            if (loadedMeanwhile.isPresent()) {
                return loadedMeanwhile.get();
            }
            StoredEntry entry = readWithRetry(() -> store.get(key))
                .orElseThrow(() -> new ConfigNotFoundException(key));
            cache.put(key, entry, cacheTtl);
            return entry;
        });
    }

    /**
     * Value of an active entry, or {@code defaultValue} when the key does not exist.
     */
    public JsonNode getConfigValue(String key, JsonNode defaultValue) {
        try {
            return getConfig(key).value();
        } catch (ConfigNotFoundException e) {
            log.debug("Config {} not found, using default value", key);
            return defaultValue;
        }
    }

    public List<StoredEntry> getConfigsByCategory(String category) {
        return readWithRetry(() -> store.getByCategory(category));
    }

    public List<StoredEntry> getConfigsByKind(ConfigKind kind) {
        return readWithRetry(() -> store.getByKind(kind));
    }

    public List<StoredEntry> getAllConfigs() {
        return readWithRetry(store::getAll);
    }

    public List<ChangeEvent> getHistory(String key) {
        return readWithRetry(() -> store.getHistory(key));
    }

    /**
     * Validate against the supplied schema, or the stored one when none is supplied.
     */
    public StoredEntry updateConfig(String key, UpdateConfigCommand command) {
        log.info("Updating config {} by {}", key, command.actor());

        return keyedLock.withLock(key, () -> {
            JsonNode schema = command.validationSchema();
            if (schema == null) {
                schema = store.get(key)
                    .orElseThrow(() -> new ConfigNotFoundException(key))
                    .validationSchema();
            }
            JsonNode value = validateOrThrow(key, command.value(), schema);

            StoredEntry updated = store.update(key, value, command.description(), command.validationSchema(), command.actor());
            cache.invalidate(key);
            changeBus.publish(key, updated.value(), ChangeAction.UPDATE);

            log.info("Config {} updated to version {}", key, updated.version());
            return updated;
        });
    }

    public StoredEntry deleteConfig(String key, String actor) {
        log.info("Deleting config {} by {}", key, actor);

        return keyedLock.withLock(key, () -> {
            StoredEntry deleted = store.delete(key, actor);
            cache.invalidate(key);
            changeBus.publish(key, null, ChangeAction.DELETE);
            return deleted;
        });
    }

    public StoredEntry restoreConfig(String key, String actor) {
        log.info("Restoring config {} by {}", key, actor);

        return keyedLock.withLock(key, () -> {
            StoredEntry restored = store.restore(key, actor);
            cache.invalidate(key);
            changeBus.publish(key, restored.value(), ChangeAction.RESTORE);
            return restored;
        });
    }

    /**
     * Dry run: no persistence, no notification. A malformed schema is reported
     * as an error on path "schema".
     */
    public ValidationResult validate(JsonNode value, JsonNode schema) {
        JsonNode input = value == null ? NullNode.getInstance() : value;
        if (schema == null || schema.isNull()) {
            return ValidationResult.valid(input);
        }
        try {
            return schemaCompiler.compile(schema).validate(input);
        } catch (SchemaException e) {
            log.warn("Rejected malformed validation schema: {}", e.getMessage());
            return ValidationResult.invalid(List.of(new FieldError("schema", e.getMessage())));
        }
    }

    /**
     * @param key key to evict, or null to clear the whole cache
     */
    public void clearCache(String key) {
        if (key == null) {
            cache.invalidateAll();
        } else {
            cache.invalidate(key);
        }
    }

    public HealthReport healthCheck() {
        long start = System.nanoTime();
        boolean storeUp = true;
        String storeError = null;
        try {
            store.ping();
        } catch (StoreUnavailableException e) {
            log.warn("Health check: store unreachable: {}", e.getMessage());
            storeUp = false;
            storeError = e.getMessage();
        }
        long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        return new HealthReport(storeUp, latencyMs, storeError, cache.size(), changeBus.stats());
    }

    private JsonNode validateOrThrow(String key, JsonNode value, JsonNode schema) {
        ValidationResult result = validate(value, schema);
        if (!result.valid()) {
            log.warn("Validation failed for {}: {}", key, result.errors());
            throw new ConfigValidationException(key, result.errors());
        }
        return result.normalizedValue();
    }

    private <T> T readWithRetry(Supplier<T> read) {
        return Retry.decorateSupplier(readRetry, read).get();
    }
}
