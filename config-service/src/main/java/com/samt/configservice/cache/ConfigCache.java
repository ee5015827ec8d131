package com.samt.configservice.cache;

import com.samt.configservice.store.StoredEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded TTL cache of stored entries, keyed by configuration key.
 *
 * Eviction follows insertion order, not recency: when the cache grows past
 * {@code maxSize} the entry inserted first goes, and overwriting a key keeps
 * its original position. Expired entries are dropped on read.
 */
@Slf4j
public class ConfigCache {

    private record CachedEntry(StoredEntry value, Instant expiresAt, long sequence) {
    }

    /**
     * Position of a key in insertion order. Stale once the key is invalidated or re-inserted.
     */
    private record InsertionMark(String key, long sequence) {
    }

    private final ConcurrentHashMap<String, CachedEntry> entries = new ConcurrentHashMap<>();
    private final Queue<InsertionMark> insertionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingMarks = new AtomicInteger();
    private final AtomicLong sequence = new AtomicLong();
    private final int maxSize;
    private final Clock clock;

    public ConfigCache(int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache max size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public Optional<StoredEntry> get(String key) {
        CachedEntry cached = entries.get(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(cached.expiresAt())) {
            entries.remove(key, cached);
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(cached.value());
    }

    public void put(String key, StoredEntry value, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        long position = sequence.incrementAndGet();
        CachedEntry stored = entries.compute(key, (k, existing) -> existing != null
            ? new CachedEntry(value, expiresAt, existing.sequence())
            : new CachedEntry(value, expiresAt, position));
        if (stored.sequence() == position) {
            insertionOrder.add(new InsertionMark(key, position));
            pendingMarks.incrementAndGet();
        }
        evictOverflow();
        if (pendingMarks.get() > maxSize * 2) {
            compactInsertionOrder();
        }
    }

    public void invalidate(String key) {
        if (entries.remove(key) != null) {
            log.debug("Cache invalidated: {}", key);
        }
    }

    public void invalidateAll() {
        entries.clear();
        insertionOrder.clear();
        pendingMarks.set(0);
        log.info("Cache cleared");
    }

    public int size() {
        return entries.size();
    }

    private void evictOverflow() {
        while (entries.size() > maxSize) {
            InsertionMark oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            pendingMarks.decrementAndGet();
            CachedEntry current = entries.get(oldest.key());
            if (current != null && current.sequence() == oldest.sequence()
                    && entries.remove(oldest.key(), current)) {
                log.debug("Cache full ({} entries), evicted oldest entry {}", maxSize, oldest.key());
            }
        }
    }

    /**
     * Drop marks of keys that were invalidated or expired so the queue stays bounded.
     */
    private void compactInsertionOrder() {
        int removed = 0;
        for (InsertionMark mark : insertionOrder) {
            CachedEntry current = entries.get(mark.key());
            if ((current == null || current.sequence() != mark.sequence()) && insertionOrder.remove(mark)) {
                removed++;
            }
        }
        pendingMarks.addAndGet(-removed);
    }
}
