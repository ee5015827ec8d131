package com.samt.configservice.notify;

import java.util.Map;

/**
 * Snapshot of the subscription registry.
 *
 * @param perKeyCount number of subscribers per key, sorted by key
 */
public record ChangeBusStats(
    int connectedSubscribers,
    int totalSubscriptions,
    int uniqueKeys,
    Map<String, Integer> perKeyCount
) {
}
