package com.samt.configservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.service.PlatformSettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only shortcuts to the well-known platform entries.
 * A missing entry is served with its built-in default, never 404.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final PlatformSettingsService settings;

    @GetMapping("/cpa/level-amounts")
    public ResponseEntity<Map<String, Object>> getCpaLevelAmounts() {
        return ok(settings.getCpaLevelAmounts());
    }

    @GetMapping("/cpa/validation-rules")
    public ResponseEntity<Map<String, Object>> getCpaValidationRules() {
        return ok(settings.getCpaValidationRules());
    }

    @GetMapping("/system/settings")
    public ResponseEntity<Map<String, Object>> getSystemSettings() {
        return ok(settings.getSystemSettings());
    }

    @GetMapping("/mlm/settings")
    public ResponseEntity<Map<String, Object>> getMlmSettings() {
        return ok(settings.getMlmSettings());
    }

    @GetMapping("/external-apis/settings")
    public ResponseEntity<Map<String, Object>> getExternalApisSettings() {
        return ok(settings.getExternalApisSettings());
    }

    private static ResponseEntity<Map<String, Object>> ok(JsonNode data) {
        return ResponseEntity.ok(Map.of(
            "data", data,
            "timestamp", Instant.now().toString()
        ));
    }
}
