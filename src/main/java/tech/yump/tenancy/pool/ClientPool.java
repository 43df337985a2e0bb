package tech.yump.tenancy.pool;

import lombok.extern.slf4j.Slf4j;
import tech.yump.tenancy.cache.CacheEntry;
import tech.yump.tenancy.cache.ExpiringCache;
import tech.yump.tenancy.metrics.MetricsRecorder;
import tech.yump.tenancy.tenant.TenantConfigCache;
import tech.yump.tenancy.tenant.TenantConnectionConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Capacity-bounded, TTL-evicted cache of live tenant clients keyed by (tenant, role).
 *
 * <p>Concurrent misses for the same key share one in-flight construction. The capacity
 * check and the registration of a construction happen under one lock, so clients being
 * built count against {@code maxClients} and the pool never over-commits.
 *
 * <p>Each tenant carries an invalidation generation. A construction that started before
 * {@link #invalidate(String)} or {@link #invalidateAll()} still hands its client to the callers
 * waiting on it, but the client is not cached; it is retired and closed on the next sweep.
 */
@Slf4j
public class ClientPool {

    private final TenantConfigCache configCache;
    private final TenantClientFactory clientFactory;
    private final MetricsRecorder metrics;
    private final int maxClients;
    private final Duration ttl;
    private final Clock clock;

    private final ExpiringCache<ClientKey, TenantClient> clients = new ExpiringCache<>("tenant-client");
    private final Map<ClientKey, CompletableFuture<TenantClient>> inFlight = new ConcurrentHashMap<>();
    private final Object capacityLock = new Object();

    // Guarded by capacityLock.
    private final Map<String, Long> tenantGenerations = new HashMap<>();
    private long globalGeneration;

    private final Queue<TenantClient> retired = new ConcurrentLinkedQueue<>();

    public ClientPool(TenantConfigCache configCache,
                      TenantClientFactory clientFactory,
                      MetricsRecorder metrics,
                      int maxClients,
                      Duration ttl,
                      Clock clock) {
        if (maxClients < 1) {
            throw new IllegalArgumentException("maxClients must be at least 1, got " + maxClients);
        }
        this.configCache = configCache;
        this.clientFactory = clientFactory;
        this.metrics = metrics;
        this.maxClients = maxClients;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached client for the key, building one on a miss.
     *
     * @throws PoolExhaustedException if a new client is needed and the pool is full
     */
    public TenantClient getClient(String tenantId, ClientRole role) {
        ClientKey key = new ClientKey(tenantId, role);

        Optional<TenantClient> cached = clients.getIfLive(key, clock.instant());
        if (cached.isPresent()) {
            metrics.recordHit();
            log.debug("Client cache hit for {}", key);
            return cached.get();
        }

        CompletableFuture<TenantClient> pending;
        boolean owner = false;
        long generation = 0;
        synchronized (capacityLock) {
            // Another thread may have finished building while we waited for the lock.
            cached = clients.getIfLive(key, clock.instant());
            if (cached.isPresent()) {
                metrics.recordHit();
                return cached.get();
            }
            pending = inFlight.get(key);
            if (pending == null) {
                int live = clients.liveCount(clock.instant()) + inFlight.size();
                if (live >= maxClients) {
                    metrics.recordPoolExhausted();
                    log.warn("Client pool exhausted for {}: live={}, max={}", key, live, maxClients);
                    throw new PoolExhaustedException(live, maxClients);
                }
                pending = new CompletableFuture<>();
                inFlight.put(key, pending);
                generation = generationOf(tenantId);
                owner = true;
            }
        }

        if (owner) {
            return construct(key, pending, generation);
        }
        log.debug("Joining in-flight client construction for {}", key);
        TenantClient client = await(pending);
        metrics.recordHit();
        return client;
    }

    private TenantClient construct(ClientKey key, CompletableFuture<TenantClient> pending, long generation) {
        try {
            TenantConnectionConfig config = configCache.get(key.tenantId());
            TenantClient client = clientFactory.create(config, key.role());
            Instant expiresAt = clock.instant().plus(ttl);

            boolean published;
            Optional<CacheEntry<TenantClient>> replaced = Optional.empty();
            synchronized (capacityLock) {
                published = generation == generationOf(key.tenantId());
                if (published) {
                    replaced = clients.put(key, client, expiresAt);
                } else {
                    retired.add(client);
                }
                inFlight.remove(key, pending);
            }
            replaced.map(CacheEntry::value)
                    .filter(previous -> previous != client)
                    .ifPresent(TenantClient::close);

            metrics.recordClientCreated();
            metrics.recordMiss();
            if (published) {
                log.info("Created client {} (cached until {}). Pool size: {}/{}", key, expiresAt, clients.size(), maxClients);
            } else {
                log.info("Tenant '{}' was invalidated while client {} was being built; handing it out uncached",
                        key.tenantId(), key);
            }
            pending.complete(client);
            return client;
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, pending);
        }
    }

    private long generationOf(String tenantId) {
        return globalGeneration + tenantGenerations.getOrDefault(tenantId, 0L);
    }

    private TenantClient await(CompletableFuture<TenantClient> pending) {
        try {
            return pending.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Removes and closes every role's client for the tenant. Constructions already running for
     * the tenant are not cached when they finish.
     */
    public void invalidate(String tenantId) {
        List<CacheEntry<TenantClient>> removed;
        synchronized (capacityLock) {
            tenantGenerations.merge(tenantId, 1L, Long::sum);
            removed = clients.removeIf(key -> key.tenantId().equals(tenantId));
        }
        int closed = closeAll(removed);
        if (closed > 0) {
            log.info("Invalidated {} cached client(s) for tenant '{}'", closed, tenantId);
        }
    }

    public void invalidateAll() {
        List<CacheEntry<TenantClient>> removed;
        synchronized (capacityLock) {
            globalGeneration++;
            removed = clients.clear();
        }
        int closed = closeAll(removed);
        int closedRetired = closeRetired();
        log.info("Cleared {} cached tenant clients and {} retired clients", closed, closedRetired);
    }

    private int closeRetired() {
        int count = 0;
        TenantClient client;
        while ((client = retired.poll()) != null) {
            client.close();
            count++;
        }
        return count;
    }

    private int closeAll(Iterable<CacheEntry<TenantClient>> entries) {
        int count = 0;
        for (CacheEntry<TenantClient> entry : entries) {
            entry.value().close();
            count++;
        }
        return count;
    }

    /**
     * Removes expired clients and closes them, along with clients retired by an invalidation.
     *
     * @return number of expired clients removed
     */
    public int sweepExpired(Instant now) {
        int closedRetired = closeRetired();
        if (closedRetired > 0) {
            log.debug("Closed {} retired tenant clients", closedRetired);
        }
        return clients.sweepExpired(now, (key, entry) -> entry.value().close());
    }

    public int retiredCount() {
        return retired.size();
    }

    public int liveCount() {
        return clients.liveCount(clock.instant());
    }

    public int size() {
        return clients.size();
    }

    public int maxClients() {
        return maxClients;
    }
}
