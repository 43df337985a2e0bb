package tech.yump.tenancy.metrics;

/**
 * Point-in-time snapshot of pool and cache counters for observability endpoints.
 *
 * @param totalClientsCreated tenant clients constructed since the last reset
 * @param poolExhaustedCount  requests rejected because the pool was full
 * @param cacheHits           client lookups served from the pool
 * @param cacheMisses         client lookups that constructed a new client
 * @param configCacheHits     config lookups served from cache
 * @param configCacheMisses   config lookups that went to the control plane
 * @param liveClients         clients currently usable
 * @param maxClients          pool capacity
 * @param clientCacheSize     stored client entries, including expired ones awaiting sweep
 * @param configCacheSize     stored config entries, including expired ones awaiting sweep
 * @param poolUtilization     {@code liveClients / maxClients * 100}
 * @param cacheHitRate        {@code cacheHits / (cacheHits + cacheMisses) * 100}, 0 without traffic
 */
public record DataSourceStats(
        long totalClientsCreated,
        long poolExhaustedCount,
        long cacheHits,
        long cacheMisses,
        long configCacheHits,
        long configCacheMisses,
        int liveClients,
        int maxClients,
        int clientCacheSize,
        int configCacheSize,
        double poolUtilization,
        double cacheHitRate
) {
}
