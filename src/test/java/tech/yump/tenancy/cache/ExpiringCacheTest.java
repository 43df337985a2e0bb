package tech.yump.tenancy.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiringCacheTest {

    private final Instant now = Instant.parse("2024-05-01T12:00:00Z");
    private ExpiringCache<String, String> cache;

    @BeforeEach
    void setUp() {
        cache = new ExpiringCache<>("test");
    }

    @Test
    @DisplayName("Sweep removes only expired entries")
    void sweepExpired_removesOnlyExpired() {
        cache.put("A", "a", now.minusMillis(1000));
        cache.put("B", "b", now.plusMillis(1000));
        cache.put("C", "c", now.minusMillis(5000));

        List<String> removedKeys = new ArrayList<>();
        int removed = cache.sweepExpired(now, (key, entry) -> removedKeys.add(key));

        assertThat(removed).isEqualTo(2);
        assertThat(removedKeys).containsExactlyInAnyOrder("A", "C");
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.getIfLive("B", now)).contains("b");
    }

    @Test
    @DisplayName("Entry is unusable from its expiry instant, even before a sweep")
    void getIfLive_respectsExpiryBoundary() {
        Instant expiresAt = now.plusSeconds(60);
        cache.put("k", "v", expiresAt);

        assertThat(cache.getIfLive("k", expiresAt.minusMillis(1))).contains("v");
        assertThat(cache.getIfLive("k", expiresAt)).isEmpty();
        assertThat(cache.getIfLive("k", expiresAt.plusSeconds(1))).isEmpty();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("put returns the replaced entry")
    void put_returnsPreviousEntry() {
        assertThat(cache.put("k", "v1", now.plusSeconds(1))).isEmpty();

        assertThat(cache.put("k", "v2", now.plusSeconds(2)))
                .map(CacheEntry::value)
                .contains("v1");
        assertThat(cache.getIfLive("k", now)).contains("v2");
    }

    @Test
    @DisplayName("removeIf removes matching keys and returns their entries")
    void removeIf_removesMatching() {
        cache.put("t1-anon", "a", now.plusSeconds(10));
        cache.put("t1-service", "s", now.plusSeconds(10));
        cache.put("t2-service", "x", now.plusSeconds(10));

        List<CacheEntry<String>> removed = cache.removeIf(key -> key.startsWith("t1-"));

        assertThat(removed).extracting(CacheEntry::value).containsExactlyInAnyOrder("a", "s");
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.getIfLive("t2-service", now)).contains("x");
    }

    @Test
    @DisplayName("liveCount excludes expired entries that are still stored")
    void liveCount_excludesExpired() {
        cache.put("live", "1", now.plusSeconds(1));
        cache.put("dead", "2", now.minusSeconds(1));

        assertThat(cache.liveCount(now)).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("clear empties the cache and returns every entry")
    void clear_returnsAllEntries() {
        cache.put("a", "1", now.plusSeconds(1));
        cache.put("b", "2", now.minusSeconds(1));

        assertThat(cache.clear()).hasSize(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Entry refreshed after expiring survives the next sweep")
    void sweepExpired_keepsRefreshedEntry() {
        cache.put("k", "old", now.minusSeconds(1));
        cache.put("k", "fresh", now.plusSeconds(60));

        assertThat(cache.sweepExpired(now)).isZero();
        assertThat(cache.getIfLive("k", now)).contains("fresh");
    }
}
