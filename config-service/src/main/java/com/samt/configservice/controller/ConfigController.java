package com.samt.configservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.samt.configservice.dto.request.CreateConfigRequest;
import com.samt.configservice.dto.request.UpdateConfigRequest;
import com.samt.configservice.dto.request.ValidateConfigRequest;
import com.samt.configservice.dto.response.ConfigResponse;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.exception.BadRequestException;
import com.samt.configservice.schema.ValidationResult;
import com.samt.configservice.service.ConfigEngine;
import com.samt.configservice.service.CreateConfigCommand;
import com.samt.configservice.service.UpdateConfigCommand;
import com.samt.configservice.store.StoredEntry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for configuration entries.
 *
 * Base path: /api/configs
 * Actor: X-Actor header, recorded as author of mutations (default api_user)
 */
@RestController
@RequestMapping("/api/configs")
@RequiredArgsConstructor
@Slf4j
public class ConfigController {

    static final String ACTOR_HEADER = "X-Actor";
    static final String DEFAULT_ACTOR = "api_user";

    private final ConfigEngine engine;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getAllConfigs() {
        return ok(toResponses(engine.getAllConfigs()));
    }

    /**
     * POST /api/configs
     * Create a configuration entry. 409 if the key is live or retired.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createConfig(
            @Valid @RequestBody CreateConfigRequest request,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {

        StoredEntry created = engine.createConfig(CreateConfigCommand.builder()
            .key(request.key())
            .value(request.value())
            .kind(request.kind())
            .category(request.category())
            .description(request.description())
            .validationSchema(request.validationSchema())
            .actor(actor)
            .build());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(envelope(ConfigResponse.from(created)));
    }

    /**
     * POST /api/configs/validate
     * Dry-run validation; always 200, the verdict is in the body.
     */
    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@Valid @RequestBody ValidateConfigRequest request) {
        ValidationResult result = engine.validate(request.value(), request.validationSchema());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("valid", result.valid());
        if (result.valid()) {
            data.put("normalizedValue", result.normalizedValue());
        } else {
            data.put("errors", result.errors());
        }
        return ok(data);
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        engine.clearCache(null);
        return ok(Map.of("message", "Cache cleared"));
    }

    @DeleteMapping("/cache/{key}")
    public ResponseEntity<Map<String, Object>> clearCacheEntry(@PathVariable String key) {
        engine.clearCache(key);
        return ok(Map.of("message", "Cache entry cleared: " + key));
    }

    @GetMapping("/category/{category}")
    public ResponseEntity<Map<String, Object>> getConfigsByCategory(@PathVariable String category) {
        return ok(toResponses(engine.getConfigsByCategory(category)));
    }

    @GetMapping("/kind/{kind}")
    public ResponseEntity<Map<String, Object>> getConfigsByKind(@PathVariable String kind) {
        ConfigKind configKind;
        try {
            configKind = ConfigKind.fromValue(kind);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
        return ok(toResponses(engine.getConfigsByKind(configKind)));
    }

    @GetMapping("/{key}")
    public ResponseEntity<Map<String, Object>> getConfig(@PathVariable String key) {
        return ok(ConfigResponse.from(engine.getConfig(key)));
    }

    /**
     * GET /api/configs/{key}/value
     * Bare value; JSON null when the key does not exist.
     */
    @GetMapping("/{key}/value")
    public ResponseEntity<Map<String, Object>> getConfigValue(@PathVariable String key) {
        JsonNode value = engine.getConfigValue(key, NullNode.getInstance());
        return ok(value);
    }

    @GetMapping("/{key}/history")
    public ResponseEntity<Map<String, Object>> getHistory(@PathVariable String key) {
        return ok(engine.getHistory(key));
    }

    @PutMapping("/{key}")
    public ResponseEntity<Map<String, Object>> updateConfig(
            @PathVariable String key,
            @Valid @RequestBody UpdateConfigRequest request,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {

        StoredEntry updated = engine.updateConfig(key, UpdateConfigCommand.builder()
            .value(request.value())
            .description(request.description())
            .validationSchema(request.validationSchema())
            .actor(actor)
            .build());

        return ok(ConfigResponse.from(updated));
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<Map<String, Object>> deleteConfig(
            @PathVariable String key,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {

        StoredEntry deleted = engine.deleteConfig(key, actor);
        return ok(Map.of(
            "key", deleted.key(),
            "message", "Configuration deleted"
        ));
    }

    @PostMapping("/{key}/restore")
    public ResponseEntity<Map<String, Object>> restoreConfig(
            @PathVariable String key,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {

        return ok(ConfigResponse.from(engine.restoreConfig(key, actor)));
    }

    private static List<ConfigResponse> toResponses(List<StoredEntry> entries) {
        return entries.stream().map(ConfigResponse::from).toList();
    }

    private static ResponseEntity<Map<String, Object>> ok(Object data) {
        return ResponseEntity.ok(envelope(data));
    }

    private static Map<String, Object> envelope(Object data) {
        return Map.of(
            "data", data,
            "timestamp", Instant.now().toString()
        );
    }
}
