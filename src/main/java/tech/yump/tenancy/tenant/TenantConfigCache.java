package tech.yump.tenancy.tenant;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.tenancy.cache.CacheEntry;
import tech.yump.tenancy.cache.ExpiringCache;
import tech.yump.tenancy.core.TenantConfigurationException;
import tech.yump.tenancy.crypto.CredentialCipher;
import tech.yump.tenancy.crypto.DecryptionException;
import tech.yump.tenancy.metrics.MetricsRecorder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Time-bounded cache of decrypted tenant connection configuration.
 * Misses load the tenant row from the control plane and decrypt both secrets.
 *
 * <p>A load that overlaps an invalidation of its tenant returns what it read but does not cache it.
 */
@Slf4j
public class TenantConfigCache {

    private final ControlPlaneTenantRepository repository;
    private final CredentialCipher cipher;
    private final MetricsRecorder metrics;
    private final Duration ttl;
    private final Clock clock;
    private final ExpiringCache<String, TenantConnectionConfig> cache = new ExpiringCache<>("tenant-config");

    private final Object generationLock = new Object();
    // Guarded by generationLock.
    private final Map<String, Long> tenantGenerations = new HashMap<>();
    private long globalGeneration;

    public TenantConfigCache(ControlPlaneTenantRepository repository,
                             CredentialCipher cipher,
                             MetricsRecorder metrics,
                             Duration ttl,
                             Clock clock) {
        this.repository = repository;
        this.cipher = cipher;
        this.metrics = metrics;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the tenant's decrypted configuration.
     *
     * @throws TenantNotFoundException      if the control plane has no row for the tenant
     * @throws TenantConfigurationException if the row has no data source or secrets
     * @throws DecryptionException          if a stored secret fails to decrypt
     */
    public TenantConnectionConfig get(String tenantId) {
        if (!StringUtils.hasText(tenantId)) {
            throw new IllegalArgumentException("Tenant id must not be blank.");
        }

        Optional<TenantConnectionConfig> cached = cache.getIfLive(tenantId, clock.instant());
        if (cached.isPresent()) {
            metrics.recordConfigHit();
            log.debug("Config cache hit for tenant '{}'", tenantId);
            return cached.get();
        }

        long generation;
        synchronized (generationLock) {
            generation = generationOf(tenantId);
        }

        TenantConnectionRecord record = repository.findConnectionRecord(tenantId)
                .orElseThrow(() -> {
                    log.warn("No control-plane row found for tenant '{}'", tenantId);
                    return new TenantNotFoundException(tenantId);
                });

        TenantConnectionConfig config = decrypt(record);
        Instant expiresAt = clock.instant().plus(ttl);
        boolean stored;
        synchronized (generationLock) {
            stored = generation == generationOf(tenantId);
            if (stored) {
                cache.put(tenantId, config, expiresAt);
            }
        }
        metrics.recordConfigMiss();
        if (stored) {
            log.debug("Config cache miss for tenant '{}'; cached until {}", tenantId, expiresAt);
        } else {
            log.debug("Config for tenant '{}' was invalidated during the load; not cached", tenantId);
        }
        return config;
    }

    private long generationOf(String tenantId) {
        return globalGeneration + tenantGenerations.getOrDefault(tenantId, 0L);
    }

    private TenantConnectionConfig decrypt(TenantConnectionRecord record) {
        String tenantId = record.tenantId();
        if (!StringUtils.hasText(record.dataSourceUrl())) {
            log.error("Tenant '{}' has no data source configured", tenantId);
            throw new TenantConfigurationException("Tenant " + tenantId + " has no data source configured");
        }
        String anonSecret = decryptSecret(tenantId, "anon", record.encryptedAnonSecret());
        String serviceSecret = decryptSecret(tenantId, "service", record.encryptedServiceSecret());
        String mappedId = StringUtils.hasText(record.tenantIdInDataSource())
                ? record.tenantIdInDataSource()
                : tenantId;

        return new TenantConnectionConfig(
                tenantId,
                record.dataSourceUrl(),
                anonSecret,
                serviceSecret,
                record.anonUsername(),
                record.serviceUsername(),
                record.region(),
                mappedId,
                record.poolConfig() != null ? record.poolConfig() : PoolConfig.DEFAULT
        );
    }

    private String decryptSecret(String tenantId, String kind, String encrypted) {
        if (!StringUtils.hasText(encrypted)) {
            throw new TenantConfigurationException("Tenant " + tenantId + " has no " + kind + " secret configured");
        }
        try {
            return cipher.decrypt(encrypted);
        } catch (DecryptionException e) {
            log.error("Failed to decrypt {} secret for tenant '{}': {}", kind, tenantId, e.getMessage());
            throw e;
        }
    }

    public void invalidate(String tenantId) {
        Optional<CacheEntry<TenantConnectionConfig>> removed;
        synchronized (generationLock) {
            tenantGenerations.merge(tenantId, 1L, Long::sum);
            removed = cache.remove(tenantId);
        }
        removed.ifPresent(entry -> log.info("Invalidated cached config for tenant '{}'", tenantId));
    }

    public void invalidateAll() {
        int cleared;
        synchronized (generationLock) {
            globalGeneration++;
            cleared = cache.clear().size();
        }
        log.info("Cleared {} cached tenant config entries", cleared);
    }

    public Optional<CacheEntry<TenantConnectionConfig>> entry(String tenantId) {
        return cache.getEntry(tenantId);
    }

    public int sweepExpired(Instant now) {
        return cache.sweepExpired(now);
    }

    public int size() {
        return cache.size();
    }
}
