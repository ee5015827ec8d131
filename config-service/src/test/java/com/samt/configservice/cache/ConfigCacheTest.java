package com.samt.configservice.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.store.StoredEntry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigCacheTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    @Test
    void hitsUntilExpiry() {
        ConfigCache cache = new ConfigCache(10, clock);
        cache.put("a", entry("a", 1), TTL);

        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.get("a")).map(StoredEntry::version).contains(1);

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictsOldestInsertedEntryWhenFull() {
        ConfigCache cache = new ConfigCache(2, clock);
        cache.put("a", entry("a", 1), TTL);
        cache.put("b", entry("b", 1), TTL);

        // Reading "a" does not refresh its position
        cache.get("a");
        cache.put("c", entry("c", 1), TTL);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).isPresent();
        assertThat(cache.get("c")).isPresent();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void overwriteKeepsOriginalInsertionPosition() {
        ConfigCache cache = new ConfigCache(2, clock);
        cache.put("a", entry("a", 1), TTL);
        cache.put("b", entry("b", 1), TTL);
        cache.put("a", entry("a", 2), TTL);

        cache.put("c", entry("c", 1), TTL);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).isPresent();
    }

    @Test
    void reinsertAfterInvalidateMovesToTheBack() {
        ConfigCache cache = new ConfigCache(2, clock);
        cache.put("a", entry("a", 1), TTL);
        cache.put("b", entry("b", 1), TTL);
        cache.invalidate("a");
        cache.put("a", entry("a", 2), TTL);

        cache.put("c", entry("c", 1), TTL);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).map(StoredEntry::version).contains(2);
        assertThat(cache.get("c")).isPresent();
    }

    @Test
    void invalidateAllEmptiesCache() {
        ConfigCache cache = new ConfigCache(10, clock);
        cache.put("a", entry("a", 1), TTL);
        cache.put("b", entry("b", 1), TTL);

        cache.invalidateAll();

        assertThat(cache.size()).isZero();
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void repeatedInvalidationKeepsEvictionWorking() {
        ConfigCache cache = new ConfigCache(3, clock);
        for (int i = 0; i < 100; i++) {
            cache.put("churn", entry("churn", i), TTL);
            cache.invalidate("churn");
        }
        cache.put("a", entry("a", 1), TTL);
        cache.put("b", entry("b", 1), TTL);
        cache.put("c", entry("c", 1), TTL);
        cache.put("d", entry("d", 1), TTL);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("d")).isPresent();
    }

    @Test
    void mutatingReturnedValueDoesNotAlterCachedSnapshot() {
        ConfigCache cache = new ConfigCache(10, clock);
        ObjectNode amounts = JsonNodeFactory.instance.objectNode().put("level_1", 50);
        cache.put("cpa_level_amounts", StoredEntry.builder()
            .key("cpa_level_amounts")
            .value(amounts)
            .kind(ConfigKind.CPA)
            .category("commission")
            .version(1)
            .active(true)
            .build(), TTL);

        amounts.put("level_1", 1);
        ((ObjectNode) cache.get("cpa_level_amounts").orElseThrow().value()).put("level_1", 999);

        assertThat(cache.get("cpa_level_amounts").orElseThrow().value().get("level_1").intValue()).isEqualTo(50);
    }

    @Test
    void rejectsNonPositiveMaxSize() {
        assertThatThrownBy(() -> new ConfigCache(0, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static StoredEntry entry(String key, int version) {
        return StoredEntry.builder()
            .key(key)
            .value(JsonNodeFactory.instance.numberNode(version))
            .kind(ConfigKind.SYSTEM)
            .category("general")
            .version(version)
            .active(true)
            .build();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
