package com.samt.configservice.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.samt.common.events.ChangeAction;
import com.samt.configservice.cache.ConfigCache;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.exception.ConfigNotFoundException;
import com.samt.configservice.exception.ConfigValidationException;
import com.samt.configservice.exception.StoreUnavailableException;
import com.samt.configservice.notify.ChangeBus;
import com.samt.configservice.notify.ChangeBusStats;
import com.samt.configservice.schema.FieldError;
import com.samt.configservice.schema.SchemaCompiler;
import com.samt.configservice.schema.ValidationResult;
import com.samt.configservice.store.ConfigStore;
import com.samt.configservice.store.NewEntry;
import com.samt.configservice.store.StoredEntry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ConfigEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ConfigStore store;
    private ConfigCache cache;
    private ChangeBus changeBus;
    private ConfigEngine engine;

    @BeforeEach
    void setUp() {
        store = mock(ConfigStore.class);
        cache = spy(new ConfigCache(100, Clock.systemUTC()));
        changeBus = mock(ChangeBus.class);

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(1))
            .retryExceptions(StoreUnavailableException.class)
            .build());

        engine = new ConfigEngine(new SchemaCompiler(), store, cache, changeBus, retryRegistry, 60);
    }

    @Test
    void createValidatesPersistsInvalidatesThenPublishes() {
        JsonNode value = json("{\"level_1\":\"50\"}");
        JsonNode schema = json("{\"type\":\"object\",\"properties\":{\"level_1\":{\"type\":\"number\",\"minimum\":0}}}");
        when(store.create(any())).thenAnswer(invocation -> stored(invocation.<NewEntry>getArgument(0).value(), 1));

        StoredEntry created = engine.createConfig(CreateConfigCommand.builder()
            .key("cpa_level_amounts").value(value).kind(ConfigKind.CPA).category("commission")
            .validationSchema(schema).actor("admin").build());

        ArgumentCaptor<NewEntry> persisted = ArgumentCaptor.forClass(NewEntry.class);
        InOrder inOrder = inOrder(store, cache, changeBus);
        inOrder.verify(store).create(persisted.capture());
        inOrder.verify(cache).invalidate("cpa_level_amounts");
        inOrder.verify(changeBus).publish(eq("cpa_level_amounts"), any(), eq(ChangeAction.CREATE));

        // numeric string normalized before persisting
        assertThat(persisted.getValue().value().get("level_1").isNumber()).isTrue();
        assertThat(persisted.getValue().createdBy()).isEqualTo("admin");
        assertThat(created.version()).isEqualTo(1);
    }

    @Test
    void validationFailureAbortsBeforePersistenceAndNotification() {
        JsonNode schema = json("{\"type\":\"object\",\"properties\":{\"x\":{\"type\":\"number\",\"minimum\":0}}}");

        assertThatThrownBy(() -> engine.createConfig(CreateConfigCommand.builder()
                .key("limits").value(json("{\"x\":-1}")).kind(ConfigKind.SYSTEM).category("system")
                .validationSchema(schema).actor("admin").build()))
            .isInstanceOfSatisfying(ConfigValidationException.class, ex ->
                assertThat(ex.getErrors()).extracting(FieldError::path).containsExactly("x"));

        verifyNoInteractions(store, changeBus);
    }

    @Test
    void malformedSchemaIsReportedAsValidationErrorOnSchemaPath() {
        assertThatThrownBy(() -> engine.createConfig(CreateConfigCommand.builder()
                .key("limits").value(json("{}")).kind(ConfigKind.SYSTEM).category("system")
                .validationSchema(json("{\"type\":42}")).actor("admin").build()))
            .isInstanceOfSatisfying(ConfigValidationException.class, ex ->
                assertThat(ex.getErrors()).singleElement()
                    .extracting(FieldError::path).isEqualTo("schema"));

        verifyNoInteractions(store, changeBus);
    }

    @Test
    void updateValidatesAgainstStoredSchemaWhenNoneSupplied() {
        JsonNode schema = json("{\"type\":\"object\",\"properties\":{\"level_1\":{\"type\":\"number\",\"maximum\":100}}}");
        when(store.get("cpa_level_amounts")).thenReturn(Optional.of(storedWithSchema(json("{\"level_1\":50}"), schema)));

        assertThatThrownBy(() -> engine.updateConfig("cpa_level_amounts", UpdateConfigCommand.builder()
                .value(json("{\"level_1\":150}")).actor("ops").build()))
            .isInstanceOf(ConfigValidationException.class);

        verify(store, never()).update(any(), any(), any(), any(), any());
        verifyNoInteractions(changeBus);
    }

    @Test
    void updateInvalidatesAndPublishesAfterCommit() {
        JsonNode newValue = json("{\"level_1\":60}");
        when(store.get("cpa_level_amounts")).thenReturn(Optional.of(stored(json("{\"level_1\":50}"), 1)));
        when(store.update(eq("cpa_level_amounts"), any(), isNull(), isNull(), eq("ops"))).thenReturn(stored(newValue, 2));

        StoredEntry updated = engine.updateConfig("cpa_level_amounts",
            UpdateConfigCommand.builder().value(newValue).actor("ops").build());

        assertThat(updated.version()).isEqualTo(2);
        InOrder inOrder = inOrder(store, cache, changeBus);
        inOrder.verify(store).update(eq("cpa_level_amounts"), any(), isNull(), isNull(), eq("ops"));
        inOrder.verify(cache).invalidate("cpa_level_amounts");
        inOrder.verify(changeBus).publish("cpa_level_amounts", newValue, ChangeAction.UPDATE);
    }

    @Test
    void updateOfMissingKeyIsNotFound() {
        when(store.get("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> engine.updateConfig("missing",
                UpdateConfigCommand.builder().value(json("1")).actor("ops").build()))
            .isInstanceOf(ConfigNotFoundException.class);
    }

    @Test
    void getConfigPopulatesCacheOnMiss() {
        when(store.get("system_settings")).thenReturn(Optional.of(stored(json("{\"api_timeout\":30000}"), 1)));

        engine.getConfig("system_settings");
        StoredEntry second = engine.getConfig("system_settings");

        assertThat(second.value().get("api_timeout").intValue()).isEqualTo(30000);
        verify(store, times(1)).get("system_settings");
    }

    @Test
    void mutationInvalidatesCachedEntry() {
        when(store.get("system_settings")).thenReturn(Optional.of(stored(json("1"), 1)));
        engine.getConfig("system_settings");
        when(store.delete("system_settings", "ops")).thenReturn(stored(json("1"), 1));

        engine.deleteConfig("system_settings", "ops");

        assertThat(cache.get("system_settings")).isEmpty();
        verify(changeBus).publish("system_settings", null, ChangeAction.DELETE);
    }

    @Test
    void readsAreRetriedWhenStoreIsUnavailable() {
        when(store.get("system_settings"))
            .thenThrow(new StoreUnavailableException("get", new RuntimeException("connection reset")))
            .thenReturn(Optional.of(stored(json("1"), 1)));

        assertThat(engine.getConfig("system_settings").version()).isEqualTo(1);
        verify(store, times(2)).get("system_settings");
    }

    @Test
    void writesAreNotRetried() {
        when(store.delete("system_settings", "ops"))
            .thenThrow(new StoreUnavailableException("delete", new RuntimeException("timeout")));

        assertThatThrownBy(() -> engine.deleteConfig("system_settings", "ops"))
            .isInstanceOf(StoreUnavailableException.class);
        verify(store, times(1)).delete("system_settings", "ops");
        verifyNoInteractions(changeBus);
    }

    @Test
    void getConfigValueFallsBackToDefault() {
        when(store.get("mlm_settings")).thenReturn(Optional.empty());
        JsonNode fallback = json("{\"currency\":\"BRL\"}");

        assertThat(engine.getConfigValue("mlm_settings", fallback)).isEqualTo(fallback);
    }

    @Test
    void restorePublishesCurrentValue() {
        JsonNode value = json("{\"beta\":true}");
        when(store.restore("feature_flags", "ops")).thenReturn(stored(value, 1));

        engine.restoreConfig("feature_flags", "ops");

        verify(cache).invalidate("feature_flags");
        verify(changeBus).publish("feature_flags", value, ChangeAction.RESTORE);
    }

    @Test
    void validateWithoutSchemaReturnsInputUnchanged() {
        JsonNode value = json("{\"anything\":\"goes\"}");

        ValidationResult result = engine.validate(value, null);

        assertThat(result.valid()).isTrue();
        assertThat(result.normalizedValue()).isEqualTo(value);
        verifyNoInteractions(store);
    }

    @Test
    void clearCacheWithoutKeyClearsEverything() {
        cache.put("a", stored(json("1"), 1), Duration.ofMinutes(1));
        cache.put("b", stored(json("2"), 1), Duration.ofMinutes(1));

        engine.clearCache("a");
        assertThat(cache.size()).isEqualTo(1);

        engine.clearCache(null);
        assertThat(cache.size()).isZero();
    }

    @Test
    void healthCheckReportsUnreachableStore() {
        doThrow(new StoreUnavailableException("ping", new RuntimeException("refused"))).when(store).ping();
        when(changeBus.stats()).thenReturn(new ChangeBusStats(0, 0, 0, Map.of()));

        HealthReport report = engine.healthCheck();

        assertThat(report.storeUp()).isFalse();
        assertThat(report.storeError()).contains("refused");
    }

    @Test
    void healthCheckReportsReachableStore() {
        when(changeBus.stats()).thenReturn(new ChangeBusStats(2, 3, 1, Map.of("a", 2)));

        HealthReport report = engine.healthCheck();

        assertThat(report.storeUp()).isTrue();
        assertThat(report.storeError()).isNull();
        assertThat(report.notifications().connectedSubscribers()).isEqualTo(2);
    }

    private StoredEntry stored(JsonNode value, int version) {
        return entry(value, null, version);
    }

    private StoredEntry storedWithSchema(JsonNode value, JsonNode schema) {
        return entry(value, schema, 1);
    }

    private StoredEntry entry(JsonNode value, JsonNode schema, int version) {
        return StoredEntry.builder()
            .key("key")
            .value(value == null ? NullNode.getInstance() : value)
            .kind(ConfigKind.SYSTEM)
            .category("system")
            .validationSchema(schema)
            .version(version)
            .active(true)
            .build();
    }

    private JsonNode json(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }
}
