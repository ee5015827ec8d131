package com.samt.configservice.service;

import com.samt.configservice.notify.ChangeBusStats;

/**
 * @param storeError cause of the failed probe, null when the store is up
 */
public record HealthReport(
    boolean storeUp,
    long storeLatencyMs,
    String storeError,
    int cachedEntries,
    ChangeBusStats notifications
) {
}
