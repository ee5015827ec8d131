package com.samt.configservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

/**
 * Typed access to the well-known platform entries.
 *
 * Each getter returns the stored value, or a built-in default when the entry
 * does not exist or was retired. Defaults are never written to the store.
 */
@Service
public class PlatformSettingsService {

    public static final String CPA_LEVEL_AMOUNTS = "cpa_level_amounts";
    public static final String CPA_VALIDATION_RULES = "cpa_validation_rules";
    public static final String SYSTEM_SETTINGS = "system_settings";
    public static final String MLM_SETTINGS = "mlm_settings";
    public static final String EXTERNAL_APIS = "external_apis";

    private final ConfigEngine engine;
    private final JsonNode cpaLevelAmountsDefault;
    private final JsonNode cpaValidationRulesDefault;
    private final JsonNode systemSettingsDefault;
    private final JsonNode mlmSettingsDefault;
    private final JsonNode externalApisDefault;

    public PlatformSettingsService(ConfigEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.cpaLevelAmountsDefault = parse(objectMapper, """
            {"level_1": 50.00, "level_2": 20.00, "level_3": 5.00, "level_4": 5.00, "level_5": 5.00}
            """);
        this.cpaValidationRulesDefault = parse(objectMapper, """
            {"groups": [], "group_operator": "OR"}
            """);
        this.systemSettingsDefault = parse(objectMapper, """
            {"api_timeout": 30000, "cache_ttl": 3600, "max_retries": 3, "batch_size": 100}
            """);
        this.mlmSettingsDefault = parse(objectMapper, """
            {"max_hierarchy_levels": 5, "calculation_method": "standard", "auto_distribution": true,
             "minimum_amount": 0.01, "currency": "BRL"}
            """);
        this.externalApisDefault = parse(objectMapper, """
            {"operation_db": {"sync_interval": 300000, "batch_size": 1000, "timeout": 30000},
             "notification_service": {"retry_attempts": 3, "retry_delay": 5000}}
            """);
    }

    public JsonNode getCpaLevelAmounts() {
        return valueOrDefault(CPA_LEVEL_AMOUNTS, cpaLevelAmountsDefault);
    }

    public JsonNode getCpaValidationRules() {
        return valueOrDefault(CPA_VALIDATION_RULES, cpaValidationRulesDefault);
    }

    public JsonNode getSystemSettings() {
        return valueOrDefault(SYSTEM_SETTINGS, systemSettingsDefault);
    }

    public JsonNode getMlmSettings() {
        return valueOrDefault(MLM_SETTINGS, mlmSettingsDefault);
    }

    public JsonNode getExternalApisSettings() {
        return valueOrDefault(EXTERNAL_APIS, externalApisDefault);
    }

    private JsonNode valueOrDefault(String key, JsonNode defaultValue) {
        // copy so callers cannot alter the shared default
        return engine.getConfigValue(key, defaultValue.deepCopy());
    }

    private static JsonNode parse(ObjectMapper objectMapper, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid built-in default: " + json, e);
        }
    }
}
