package com.samt.configservice.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.samt.common.events.ChangeAction;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.entity.ConfigurationEntry;
import com.samt.configservice.exception.ConfigAlreadyExistsException;
import com.samt.configservice.exception.ConfigNotFoundException;
import com.samt.configservice.exception.ConflictException;
import com.samt.configservice.exception.StoreUnavailableException;
import com.samt.configservice.repository.ConfigurationEntryRepository;
import com.samt.configservice.store.ChangeEvent;
import com.samt.configservice.store.ChangeHistoryCodec;
import com.samt.configservice.store.ConfigStore;
import com.samt.configservice.store.NewEntry;
import com.samt.configservice.store.StoredEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JPA implementation of {@link ConfigStore}.
 *
 * Business Rules:
 * - BR-STORE-01: one row per key for its whole life; deletion only clears {@code active}
 * - BR-STORE-02: a retired key cannot be created again, only restored
 * - BR-STORE-03: updates lock the row (PESSIMISTIC_WRITE) and bump version by exactly 1
 * - BR-STORE-04: change log keeps the 50 most recent events; a failure to write it
 *   is logged and does not roll back the mutation
 * - BR-STORE-05: every call runs in its own transaction bounded by
 *   {@code config.store.timeout-seconds}
 */
@Component
@Slf4j
public class ConfigStoreImpl implements ConfigStore {

    private final ConfigurationEntryRepository repository;
    private final ChangeHistoryCodec historyCodec;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    public ConfigStoreImpl(
            ConfigurationEntryRepository repository,
            ChangeHistoryCodec historyCodec,
            PlatformTransactionManager transactionManager,
            @Value("${config.store.timeout-seconds:5}") int timeoutSeconds) {
        this.repository = repository;
        this.historyCodec = historyCodec;

        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setTimeout(timeoutSeconds);

        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setTimeout(timeoutSeconds);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public StoredEntry create(NewEntry entry) {
        try {
            return execute(writeTransaction, "create", status -> {
                repository.findByConfigKey(entry.key()).ifPresent(existing -> {
                    throw new ConfigAlreadyExistsException(entry.key(), !existing.isActive());
                });

                ConfigurationEntry row = ConfigurationEntry.builder()
                    .configKey(entry.key())
                    .configValue(entry.value())
                    .kind(entry.kind())
                    .category(entry.category())
                    .description(entry.description())
                    .validationSchema(entry.validationSchema())
                    .version(1)
                    .active(true)
                    .changeLog("[]")
                    .createdBy(entry.createdBy())
                    .build();
                appendHistory(row, new ChangeEvent(ChangeAction.CREATE, null, entry.value(), entry.createdBy(), Instant.now()));

                return toStoredEntry(repository.saveAndFlush(row));
            });
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            // Unique constraint on config_key: another writer created the key first
            log.warn("Concurrent create detected for config {}", entry.key());
            throw new ConfigAlreadyExistsException(entry.key());
        }
    }

    @Override
    public Optional<StoredEntry> get(String key) {
        return execute(readTransaction, "get", status ->
            repository.findByConfigKeyAndActiveTrue(key).map(this::toStoredEntry));
    }

    @Override
    public List<StoredEntry> getByCategory(String category) {
        return execute(readTransaction, "getByCategory", status ->
            toStoredEntries(repository.findByCategoryAndActiveTrueOrderByConfigKeyAsc(category)));
    }

    @Override
    public List<StoredEntry> getByKind(ConfigKind kind) {
        return execute(readTransaction, "getByKind", status ->
            toStoredEntries(repository.findByKindAndActiveTrueOrderByConfigKeyAsc(kind)));
    }

    @Override
    public List<StoredEntry> getAll() {
        return execute(readTransaction, "getAll", status ->
            toStoredEntries(repository.findByActiveTrueOrderByCategoryAscConfigKeyAsc()));
    }

    @Override
    public StoredEntry update(String key, JsonNode newValue, String newDescription, JsonNode newSchema, String actor) {
        return execute(writeTransaction, "update", status -> {
            ConfigurationEntry row = repository.findActiveByKeyForUpdate(key)
                .orElseThrow(() -> new ConfigNotFoundException(key));

            JsonNode oldValue = row.getConfigValue();
            row.setVersion(row.getVersion() + 1);
            row.setConfigValue(newValue);
            if (newDescription != null) {
                row.setDescription(newDescription);
            }
            if (newSchema != null) {
                row.setValidationSchema(newSchema);
            }
            appendHistory(row, new ChangeEvent(ChangeAction.UPDATE, oldValue, newValue, actor, Instant.now()));

            StoredEntry updated = toStoredEntry(repository.saveAndFlush(row));
            log.debug("Config {} updated to version {}", key, updated.version());
            return updated;
        });
    }

    @Override
    public StoredEntry delete(String key, String actor) {
        return execute(writeTransaction, "delete", status -> {
            ConfigurationEntry row = repository.findActiveByKeyForUpdate(key)
                .orElseThrow(() -> new ConfigNotFoundException(key));

            row.setActive(false);
            appendHistory(row, new ChangeEvent(ChangeAction.DELETE, row.getConfigValue(), null, actor, Instant.now()));

            return toStoredEntry(repository.saveAndFlush(row));
        });
    }

    @Override
    public StoredEntry restore(String key, String actor) {
        return execute(writeTransaction, "restore", status -> {
            ConfigurationEntry row = repository.findByKeyForUpdate(key)
                .orElseThrow(() -> new ConfigNotFoundException(key));
            if (row.isActive()) {
                throw new ConflictException("Configuration is already active: " + key);
            }

            row.setActive(true);
            appendHistory(row, new ChangeEvent(ChangeAction.RESTORE, null, row.getConfigValue(), actor, Instant.now()));

            return toStoredEntry(repository.saveAndFlush(row));
        });
    }

    @Override
    public List<ChangeEvent> getHistory(String key) {
        return execute(readTransaction, "getHistory", status ->
            repository.findByConfigKey(key).map(this::readHistory).orElse(List.of()));
    }

    @Override
    public void ping() {
        execute(readTransaction, "ping", status -> repository.ping());
    }

    private <T> T execute(TransactionTemplate transaction, String operation, TransactionCallback<T> action) {
        try {
            return transaction.execute(action);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException e) {
            log.error("Store {} failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        } catch (TransactionException e) {
            log.error("Store {} transaction failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        }
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("unique") || normalized.contains("duplicate");
    }

    private void appendHistory(ConfigurationEntry row, ChangeEvent event) {
        try {
            row.setChangeLog(historyCodec.append(row.getChangeLog(), event));
        } catch (JsonProcessingException e) {
            log.error("Failed to record {} in change log of {}: {}", event.action(), row.getConfigKey(), e.getOriginalMessage());
        }
    }

    private List<ChangeEvent> readHistory(ConfigurationEntry row) {
        try {
            return historyCodec.read(row.getChangeLog());
        } catch (JsonProcessingException e) {
            log.error("Unreadable change log for {}: {}", row.getConfigKey(), e.getOriginalMessage());
            return List.of();
        }
    }

    private List<StoredEntry> toStoredEntries(List<ConfigurationEntry> rows) {
        return rows.stream().map(this::toStoredEntry).toList();
    }

    private StoredEntry toStoredEntry(ConfigurationEntry row) {
        return StoredEntry.builder()
            .id(row.getId())
            .key(row.getConfigKey())
            .value(row.getConfigValue())
            .kind(row.getKind())
            .category(row.getCategory())
            .description(row.getDescription())
            .validationSchema(row.getValidationSchema())
            .version(row.getVersion())
            .active(row.isActive())
            .changeHistory(readHistory(row))
            .createdBy(row.getCreatedBy())
            .createdAt(row.getCreatedAt())
            .updatedAt(row.getUpdatedAt())
            .build();
    }
}
