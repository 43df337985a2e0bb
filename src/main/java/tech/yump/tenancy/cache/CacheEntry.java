package tech.yump.tenancy.cache;

import java.time.Instant;

/**
 * A cached value with its expiry instant.
 *
 * @param value     the cached value
 * @param expiresAt the instant from which the entry is no longer usable
 */
public record CacheEntry<T>(T value, Instant expiresAt) {

    /**
     * An entry is live only while {@code now < expiresAt}.
     */
    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return !isLive(now);
    }
}
