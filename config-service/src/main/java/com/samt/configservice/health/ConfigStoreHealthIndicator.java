package com.samt.configservice.health;

import com.samt.configservice.service.ConfigEngine;
import com.samt.configservice.service.HealthReport;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposed as "configStore" under /actuator/health.
 */
@Component("configStore")
@RequiredArgsConstructor
public class ConfigStoreHealthIndicator implements HealthIndicator {

    private final ConfigEngine engine;

    @Override
    public Health health() {
        HealthReport report = engine.healthCheck();
        Health.Builder builder = report.storeUp() ? Health.up() : Health.down();
        builder.withDetail("responseTimeMs", report.storeLatencyMs())
            .withDetail("cachedEntries", report.cachedEntries())
            .withDetail("connectedSubscribers", report.notifications().connectedSubscribers())
            .withDetail("totalSubscriptions", report.notifications().totalSubscriptions());
        if (report.storeError() != null) {
            builder.withDetail("error", report.storeError());
        }
        return builder.build();
    }
}
