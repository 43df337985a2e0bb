package tech.yump.tenancy.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Monotonic counters for the tenant client pool and config cache.
 * When disabled, recording calls are no-ops.
 */
@Slf4j
public class MetricsRecorder {

    static final String METRIC_PREFIX = "tenant.datasource.";

    private final boolean enabled;

    private final AtomicLong totalClientsCreated = new AtomicLong();
    private final AtomicLong poolExhaustedCount = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong configCacheHits = new AtomicLong();
    private final AtomicLong configCacheMisses = new AtomicLong();

    public MetricsRecorder(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void recordHit() {
        increment(cacheHits);
    }

    public void recordMiss() {
        increment(cacheMisses);
    }

    public void recordClientCreated() {
        increment(totalClientsCreated);
    }

    public void recordPoolExhausted() {
        increment(poolExhaustedCount);
    }

    public void recordConfigHit() {
        increment(configCacheHits);
    }

    public void recordConfigMiss() {
        increment(configCacheMisses);
    }

    private void increment(AtomicLong counter) {
        if (enabled) {
            counter.incrementAndGet();
        }
    }

    /**
     * Zeroes every counter. Administrative and test use only.
     */
    public void reset() {
        totalClientsCreated.set(0);
        poolExhaustedCount.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        configCacheHits.set(0);
        configCacheMisses.set(0);
        log.info("Data source metrics counters reset.");
    }

    /**
     * Publishes the counters and cache sizes to a Micrometer registry.
     * Does nothing when metrics are disabled.
     */
    public void bindTo(MeterRegistry registry, IntSupplier clientCacheSize, IntSupplier configCacheSize) {
        if (!enabled) {
            log.info("Data source metrics disabled; not registering meters.");
            return;
        }
        functionCounter(registry, "clients.created", "Tenant clients constructed", totalClientsCreated);
        functionCounter(registry, "pool.exhausted", "Client requests rejected at pool capacity", poolExhaustedCount);
        functionCounter(registry, "client.cache.hits", "Client lookups served from the pool", cacheHits);
        functionCounter(registry, "client.cache.misses", "Client lookups that built a new client", cacheMisses);
        functionCounter(registry, "config.cache.hits", "Tenant config lookups served from cache", configCacheHits);
        functionCounter(registry, "config.cache.misses", "Tenant config lookups loaded from the control plane", configCacheMisses);
        Gauge.builder(METRIC_PREFIX + "client.cache.size", clientCacheSize, IntSupplier::getAsInt)
                .description("Stored tenant client entries")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + "config.cache.size", configCacheSize, IntSupplier::getAsInt)
                .description("Stored tenant config entries")
                .register(registry);
        log.info("Registered data source meters with {}", registry.getClass().getSimpleName());
    }

    private void functionCounter(MeterRegistry registry, String name, String description, AtomicLong source) {
        FunctionCounter.builder(METRIC_PREFIX + name, source, AtomicLong::doubleValue)
                .description(description)
                .register(registry);
    }

    public DataSourceStats snapshot(int liveClients, int maxClients, int clientCacheSize, int configCacheSize) {
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        return new DataSourceStats(
                totalClientsCreated.get(),
                poolExhaustedCount.get(),
                hits,
                misses,
                configCacheHits.get(),
                configCacheMisses.get(),
                liveClients,
                maxClients,
                clientCacheSize,
                configCacheSize,
                poolUtilization(liveClients, maxClients),
                cacheHitRate(hits, misses)
        );
    }

    public static double cacheHitRate(long hits, long misses) {
        long total = hits + misses;
        if (total == 0) {
            return 0.0;
        }
        return (double) hits / total * 100.0;
    }

    public static double poolUtilization(int liveClients, int maxClients) {
        if (maxClients <= 0) {
            return 0.0;
        }
        return (double) liveClients / maxClients * 100.0;
    }
}
