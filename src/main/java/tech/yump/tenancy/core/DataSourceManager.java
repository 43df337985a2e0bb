package tech.yump.tenancy.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.tenancy.audit.AuditHelper;
import tech.yump.tenancy.cache.CacheEntry;
import tech.yump.tenancy.crypto.CredentialCipher;
import tech.yump.tenancy.crypto.DecryptionException;
import tech.yump.tenancy.metrics.DataSourceStats;
import tech.yump.tenancy.metrics.MetricsRecorder;
import tech.yump.tenancy.pool.ClientPool;
import tech.yump.tenancy.pool.ClientRole;
import tech.yump.tenancy.pool.PoolExhaustedException;
import tech.yump.tenancy.pool.TenantClient;
import tech.yump.tenancy.pool.TenantClientFactory;
import tech.yump.tenancy.tenant.ControlPlaneTenantRepository;
import tech.yump.tenancy.tenant.MappedTenantId;
import tech.yump.tenancy.tenant.TenantConfigCache;
import tech.yump.tenancy.tenant.TenantConnectionConfig;
import tech.yump.tenancy.tenant.TenantContext;
import tech.yump.tenancy.tenant.TenantIdMapper;
import tech.yump.tenancy.tenant.TenantNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Entry point for everything that needs a tenant's data source.
 *
 * <p>Composes the config cache, the client pool and the tenant id mapper, and runs one background
 * sweep that evicts expired entries from both caches. Create one instance per process and call
 * {@link #start()} once; {@link #close()} stops the sweep and closes every pooled client.
 */
@Slf4j
public class DataSourceManager implements AutoCloseable {

    static final int CONNECTION_VALID_TIMEOUT_SECONDS = 2;
    static final String CLEANUP_THREAD_NAME = "tenant-datasource-cleanup";

    private final TenantConfigCache configCache;
    private final ClientPool clientPool;
    private final TenantIdMapper tenantIdMapper;
    private final TenantClientFactory clientFactory;
    private final ControlPlaneTenantRepository repository;
    private final CredentialCipher cipher;
    private final MetricsRecorder metrics;
    private final AuditHelper auditHelper;
    private final Duration cleanupInterval;
    private final Clock clock;

    private ScheduledExecutorService cleanupExecutor;

    public DataSourceManager(TenantConfigCache configCache,
                             ClientPool clientPool,
                             TenantIdMapper tenantIdMapper,
                             TenantClientFactory clientFactory,
                             ControlPlaneTenantRepository repository,
                             CredentialCipher cipher,
                             MetricsRecorder metrics,
                             AuditHelper auditHelper,
                             Duration cleanupInterval,
                             Clock clock) {
        this.configCache = configCache;
        this.clientPool = clientPool;
        this.tenantIdMapper = tenantIdMapper;
        this.clientFactory = clientFactory;
        this.repository = repository;
        this.cipher = cipher;
        this.metrics = metrics;
        this.auditHelper = auditHelper;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
    }

    /**
     * Starts the periodic sweep of expired config and client entries. Calling it again is a no-op.
     */
    public synchronized void start() {
        if (cleanupExecutor != null) {
            log.debug("Cleanup task already running.");
            return;
        }
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, CLEANUP_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = cleanupInterval.toMillis();
        cleanupExecutor.scheduleAtFixedRate(this::runScheduledCleanup, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Data source manager started. Max clients: {}, cleanup every {}", clientPool.maxClients(), cleanupInterval);
    }

    public synchronized boolean isRunning() {
        return cleanupExecutor != null && !cleanupExecutor.isShutdown();
    }

    /**
     * Returns the pooled client for the tenant and role, creating it on a miss.
     *
     * @throws TenantNotFoundException      if the tenant is unknown
     * @throws TenantConfigurationException if the tenant has no data source configured
     * @throws DecryptionException          if a stored secret fails to decrypt
     * @throws PoolExhaustedException       if a new client is needed and the pool is full
     */
    public TenantClient getClient(String tenantId, ClientRole role) {
        return audited(tenantId, () -> clientPool.getClient(tenantId, role));
    }

    public TenantClient getClient(String tenantId) {
        return getClient(tenantId, ClientRole.DEFAULT);
    }

    /**
     * Returns the tenant's decrypted connection configuration.
     */
    public TenantConnectionConfig getTenantConnectionConfig(String tenantId) {
        return audited(tenantId, () -> configCache.get(tenantId));
    }

    public MappedTenantId getTenantIdInDataSource(String tenantId) {
        return audited(tenantId, () -> tenantIdMapper.getTenantIdInDataSource(tenantId));
    }

    /**
     * Bundles the pooled client with the tenant's mapped id for request handling.
     */
    public TenantContext openTenantContext(String tenantId, ClientRole role) {
        TenantClient client = getClient(tenantId, role);
        MappedTenantId mappedTenantId = getTenantIdInDataSource(tenantId);
        return new TenantContext(client, tenantId, mappedTenantId);
    }

    public TenantContext openTenantContext(String tenantId) {
        return openTenantContext(tenantId, ClientRole.DEFAULT);
    }

    /**
     * Checks that the tenant's data source accepts a connection and answers a trivial query.
     * Uses a throwaway client outside the pool. Every failure is reported in the result.
     */
    public ConnectionTestResult testTenantConnection(String tenantId) {
        long startNanos = System.nanoTime();
        boolean canConnect = false;
        try {
            TenantConnectionConfig config = configCache.get(tenantId);
            try (TenantClient client = clientFactory.create(config, ClientRole.SERVICE)) {
                canConnect = client.isValid(CONNECTION_VALID_TIMEOUT_SECONDS);
                if (!canConnect) {
                    return ConnectionTestResult.failed("Connection reported invalid", elapsedMillis(startNanos), false);
                }
                client.probe();
            }
            long elapsed = elapsedMillis(startNanos);
            log.info("Connection test for tenant '{}' succeeded in {} ms", tenantId, elapsed);
            return ConnectionTestResult.succeeded(elapsed);
        } catch (Exception e) {
            long elapsed = elapsedMillis(startNanos);
            log.warn("Connection test for tenant '{}' failed after {} ms: {}", tenantId, elapsed, e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ConnectionTestResult.failed(message, elapsed, canConnect);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Connection details without secrets, plus the state of the tenant's config cache entry.
     */
    public ConnectionInfo getTenantConnectionInfo(String tenantId) {
        TenantConnectionConfig config = getTenantConnectionConfig(tenantId);
        Instant now = clock.instant();
        Optional<Instant> expiry = configCache.entry(tenantId)
                .filter(entry -> entry.isLive(now))
                .map(CacheEntry::expiresAt);
        return new ConnectionInfo(
                config.dataSourceUrl(),
                config.region(),
                config.poolConfig(),
                expiry.isPresent(),
                expiry.orElse(null));
    }

    public DataSourceStats getStats() {
        return metrics.snapshot(clientPool.liveCount(), clientPool.maxClients(), clientPool.size(), configCache.size());
    }

    public void resetStats() {
        metrics.reset();
        auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "reset_stats", AuditHelper.OUTCOME_SUCCESS, null, null);
    }

    /**
     * Drops the tenant's cached config and closes its pooled clients. The next request reloads both.
     */
    public void invalidate(String tenantId) {
        configCache.invalidate(tenantId);
        clientPool.invalidate(tenantId);
        log.info("Invalidated cached config and clients for tenant '{}'", tenantId);
        auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "invalidate_tenant", AuditHelper.OUTCOME_SUCCESS, tenantId, null);
    }

    public void clearAllCaches() {
        configCache.invalidateAll();
        clientPool.invalidateAll();
        log.info("Cleared all tenant config and client caches");
        auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "clear_caches", AuditHelper.OUTCOME_SUCCESS, null, null);
    }

    /**
     * Encrypts new secrets, stores them on the tenant's control-plane row and invalidates the tenant.
     *
     * @throws IllegalArgumentException if either secret is blank
     * @throws TenantNotFoundException  if the control plane has no row for the tenant
     */
    public void rotateCredentials(String tenantId, String anonSecret, String serviceSecret) {
        if (!StringUtils.hasText(tenantId)) {
            throw new IllegalArgumentException("Tenant id must not be blank.");
        }
        if (!StringUtils.hasText(anonSecret) || !StringUtils.hasText(serviceSecret)) {
            throw new IllegalArgumentException("Both anon and service secrets must be provided.");
        }

        String encryptedAnon = cipher.encrypt(anonSecret);
        String encryptedService = cipher.encrypt(serviceSecret);
        if (!repository.updateEncryptedSecrets(tenantId, encryptedAnon, encryptedService)) {
            auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "rotate_credentials", AuditHelper.OUTCOME_FAILURE,
                    tenantId, Map.of("reason", "tenant_not_found"));
            throw new TenantNotFoundException(tenantId);
        }
        log.info("Rotated data source credentials for tenant '{}'", tenantId);
        invalidate(tenantId);
        auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "rotate_credentials", AuditHelper.OUTCOME_SUCCESS, tenantId, null);
    }

    /**
     * Removes expired entries from both caches.
     *
     * @return total number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int configsRemoved = configCache.sweepExpired(now);
        int clientsRemoved = clientPool.sweepExpired(now);
        if (configsRemoved > 0 || clientsRemoved > 0) {
            log.info("Cleanup removed {} expired config(s) and {} expired client(s). Pool size: {}/{}",
                    configsRemoved, clientsRemoved, clientPool.size(), clientPool.maxClients());
        } else {
            log.debug("Cleanup found no expired entries.");
        }
        return configsRemoved + clientsRemoved;
    }

    private void runScheduledCleanup() {
        try {
            cleanupExpired();
        } catch (RuntimeException e) {
            // An exception would cancel every later run of the scheduled task.
            log.error("Scheduled cleanup of tenant caches failed: {}", e.getMessage(), e);
        }
    }

    private <T> T audited(String tenantId, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DecryptionException e) {
            auditHelper.logInternalEvent(AuditHelper.TYPE_DATASOURCE, "decrypt_secret", AuditHelper.OUTCOME_FAILURE,
                    tenantId, Map.of("error", e.getMessage()));
            throw e;
        } catch (PoolExhaustedException e) {
            auditHelper.logInternalEvent(AuditHelper.TYPE_DATASOURCE, "acquire_client", AuditHelper.OUTCOME_FAILURE,
                    tenantId, Map.of("liveClients", e.getLiveClients(), "maxClients", e.getMaxClients()));
            throw e;
        }
    }

    @Override
    public synchronized void close() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            cleanupExecutor = null;
        }
        clientPool.invalidateAll();
        log.info("Data source manager stopped.");
    }
}
