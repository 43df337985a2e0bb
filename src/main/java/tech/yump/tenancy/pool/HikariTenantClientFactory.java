package tech.yump.tenancy.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import tech.yump.tenancy.core.DataSourceManagerException;
import tech.yump.tenancy.tenant.TenantConnectionConfig;

import java.time.Duration;

/**
 * Builds tenant clients backed by a small HikariCP pool per (tenant, role).
 */
@Slf4j
public class HikariTenantClientFactory implements TenantClientFactory {

    private final Duration connectionTimeout;
    private final Duration maxLifetime;

    /**
     * @param connectionTimeout how long to wait for a connection from the tenant store
     * @param maxLifetime       upper bound on a physical connection's life, normally the client TTL
     */
    public HikariTenantClientFactory(Duration connectionTimeout, Duration maxLifetime) {
        this.connectionTimeout = connectionTimeout;
        this.maxLifetime = maxLifetime;
    }

    @Override
    public TenantClient create(TenantConnectionConfig config, ClientRole role) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.dataSourceUrl());
        hikariConfig.setUsername(config.usernameFor(role));
        hikariConfig.setPassword(config.secretFor(role));
        hikariConfig.setPoolName("tenant-" + config.tenantId() + "-" + role.name().toLowerCase());
        hikariConfig.setMaximumPoolSize(config.poolConfig().max());
        hikariConfig.setMinimumIdle(config.poolConfig().min());
        hikariConfig.setConnectionTimeout(connectionTimeout.toMillis());
        hikariConfig.setMaxLifetime(maxLifetime.toMillis());

        log.info("Creating HikariDataSource for tenant '{}', role {}, URL: {}, pool size {}..{}",
                config.tenantId(), role, config.dataSourceUrl(),
                config.poolConfig().min(), config.poolConfig().max());
        try {
            return new TenantClient(config.tenantId(), role, new HikariDataSource(hikariConfig));
        } catch (RuntimeException e) {
            log.error("Failed to create data source for tenant '{}', role {}: {}",
                    config.tenantId(), role, e.getMessage(), e);
            throw new DataSourceManagerException("Failed to create client for tenant: " + config.tenantId(), e);
        }
    }
}
