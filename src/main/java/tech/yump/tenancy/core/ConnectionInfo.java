package tech.yump.tenancy.core;

import tech.yump.tenancy.tenant.PoolConfig;

import java.time.Instant;

/**
 * Non-secret view of a tenant's connection, for diagnostics.
 *
 * @param cached      whether the tenant's decrypted config is cached and live
 * @param cacheExpiry when that config entry expires, null if it is not cached
 */
public record ConnectionInfo(
        String url,
        String region,
        PoolConfig poolConfig,
        boolean cached,
        Instant cacheExpiry
) {}
