package tech.yump.tenancy.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Thread-safe map of {@link CacheEntry} values with TTL semantics.
 *
 * <p>Lookups ignore expired entries even before a sweep has removed them.
 * {@link #sweepExpired(Instant)} runs in two phases: expired keys are collected first,
 * then each is removed only if it still maps to the entry that was found expired.
 */
@Slf4j
public class ExpiringCache<K, V> {

    private final String name;
    private final Map<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    public ExpiringCache(String name) {
        this.name = name;
    }

    public Optional<V> getIfLive(K key, Instant now) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public Optional<CacheEntry<V>> getEntry(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Stores a value, replacing any previous entry for the key.
     *
     * @return the replaced entry, if there was one
     */
    public Optional<CacheEntry<V>> put(K key, V value, Instant expiresAt) {
        return Optional.ofNullable(entries.put(key, new CacheEntry<>(value, expiresAt)));
    }

    public Optional<CacheEntry<V>> remove(K key) {
        return Optional.ofNullable(entries.remove(key));
    }

    /**
     * Removes every entry whose key matches, collecting keys before removing them.
     *
     * @return the removed entries
     */
    public List<CacheEntry<V>> removeIf(Predicate<K> keyMatcher) {
        List<K> matching = entries.keySet().stream()
                .filter(keyMatcher)
                .toList();
        return matching.stream()
                .map(entries::remove)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<CacheEntry<V>> clear() {
        return removeIf(key -> true);
    }

    /**
     * Removes expired entries and hands each removed entry to {@code onRemoved}.
     * Live entries are never touched.
     *
     * @return number of entries removed
     */
    public int sweepExpired(Instant now, BiConsumer<K, CacheEntry<V>> onRemoved) {
        List<Map.Entry<K, CacheEntry<V>>> expired = entries.entrySet().stream()
                .filter(e -> e.getValue().isExpired(now))
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();

        int removed = 0;
        for (Map.Entry<K, CacheEntry<V>> candidate : expired) {
            // A concurrent refresh replaces the entry; only the stale one is dropped.
            if (entries.remove(candidate.getKey(), candidate.getValue())) {
                onRemoved.accept(candidate.getKey(), candidate.getValue());
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired entries from {} cache. Remaining: {}", removed, name, entries.size());
        }
        return removed;
    }

    public int sweepExpired(Instant now) {
        return sweepExpired(now, (key, entry) -> { });
    }

    public int liveCount(Instant now) {
        return (int) entries.values().stream()
                .filter(entry -> entry.isLive(now))
                .count();
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     */
    public int size() {
        return entries.size();
    }
}
