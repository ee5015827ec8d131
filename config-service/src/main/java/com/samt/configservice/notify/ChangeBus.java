package com.samt.configservice.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.common.events.ChangeAction;
import com.samt.common.events.ConfigChangedEvent;
import com.samt.configservice.exception.NotificationDeliveryException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Registry of subscriber interest and fan-out of change events.
 *
 * Two indexes are kept consistent: key to subscribers and subscriber to keys.
 * Every mutation updates the subscriber index first and the key index inside
 * it, so both are always changed under the same lock order.
 *
 * Delivery is asynchronous: {@link #publish} only enqueues onto the dispatch
 * lane of the key. One subscriber failing never affects the others.
 */
@Slf4j
public class ChangeBus {

    private final ConcurrentMap<String, Set<String>> subscribersByKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> keysBySubscriber = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SubscriberSink> sinks = new ConcurrentHashMap<>();
    private final DispatchLanes dispatchLanes;
    private final Clock clock;

    public ChangeBus(DispatchLanes dispatchLanes, Clock clock) {
        this.dispatchLanes = dispatchLanes;
        this.clock = clock;
    }

    public void register(String subscriberId, SubscriberSink sink) {
        sinks.put(subscriberId, sink);
        log.info("Subscriber connected: {}", subscriberId);
    }

    /**
     * Add keys to the subscriber's interest set. Already subscribed keys are ignored.
     * A subscriber without a registered sink (never connected or already
     * dropped) is ignored as well.
     */
    public void subscribe(String subscriberId, Collection<String> keys) {
        keysBySubscriber.compute(subscriberId, (id, current) -> {
            // checked under the bin lock dropSubscriber also takes
            if (!sinks.containsKey(id)) {
                log.debug("Ignoring subscribe from unregistered subscriber {}", id);
                return current;
            }
            Set<String> subscribed = current != null ? current : ConcurrentHashMap.newKeySet();
            for (String key : keys) {
                subscribersByKey.compute(key, (k, ids) -> {
                    Set<String> subscribers = ids != null ? ids : ConcurrentHashMap.newKeySet();
                    subscribers.add(id);
                    return subscribers;
                });
                subscribed.add(key);
            }
            return subscribed;
        });
        log.debug("Subscriber {} subscribed to {}", subscriberId, keys);
    }

    /**
     * Remove keys from the subscriber's interest set. Unknown keys are ignored.
     */
    public void unsubscribe(String subscriberId, Collection<String> keys) {
        keysBySubscriber.computeIfPresent(subscriberId, (id, current) -> {
            for (String key : keys) {
                current.remove(key);
                removeFromKey(key, id);
            }
            return current.isEmpty() && !sinks.containsKey(id) ? null : current;
        });
        log.debug("Subscriber {} unsubscribed from {}", subscriberId, keys);
    }

    public Set<String> subscriptions(String subscriberId) {
        Set<String> keys = keysBySubscriber.get(subscriberId);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    /**
     * Forget a subscriber entirely: its connection and every subscription.
     */
    public void dropSubscriber(String subscriberId) {
        sinks.remove(subscriberId);
        keysBySubscriber.computeIfPresent(subscriberId, (id, keys) -> {
            keys.forEach(key -> removeFromKey(key, id));
            return null;
        });
        log.info("Subscriber disconnected: {}", subscriberId);
    }

    /**
     * Enqueue a change event for every subscriber of {@code key}.
     *
     * @param value value after the change, null for DELETE
     */
    public void publish(String key, JsonNode value, ChangeAction action) {
        ConfigChangedEvent event = ConfigChangedEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .key(key)
            .value(value)
            .action(action)
            .timestamp(clock.instant())
            .build();
        try {
            dispatchLanes.laneFor(key).execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.error("Dropped {} notification for {}: dispatch lane rejected it", action, key);
        }
    }

    public ChangeBusStats stats() {
        Map<String, Integer> perKeyCount = new TreeMap<>();
        subscribersByKey.forEach((key, ids) -> perKeyCount.put(key, ids.size()));
        int totalSubscriptions = keysBySubscriber.values().stream().mapToInt(Set::size).sum();
        return new ChangeBusStats(sinks.size(), totalSubscriptions, perKeyCount.size(), perKeyCount);
    }

    private void deliver(ConfigChangedEvent event) {
        String key = event.getKey();
        Set<String> subscribers = subscribersByKey.get(key);
        if (subscribers == null || subscribers.isEmpty()) {
            log.debug("No subscribers for {}", key);
            return;
        }

        int delivered = 0;
        for (String subscriberId : List.copyOf(subscribers)) {
            SubscriberSink sink = sinks.get(subscriberId);
            if (sink == null || !sink.isOpen()) {
                log.debug("Subscriber {} is gone, unsubscribing from {}", subscriberId, key);
                unsubscribe(subscriberId, List.of(key));
                continue;
            }
            try {
                sink.send(event);
                delivered++;
            } catch (IOException | RuntimeException e) {
                NotificationDeliveryException failure = new NotificationDeliveryException(subscriberId, key, e);
                log.warn(failure.getMessage());
            }
        }
        log.info("Notified {} subscriber(s) of {} on {}", delivered, event.getAction(), key);
    }

    private void removeFromKey(String key, String subscriberId) {
        subscribersByKey.computeIfPresent(key, (k, ids) -> {
            ids.remove(subscriberId);
            return ids.isEmpty() ? null : ids;
        });
    }
}
