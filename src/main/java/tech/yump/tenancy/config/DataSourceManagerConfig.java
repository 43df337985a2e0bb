package tech.yump.tenancy.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import tech.yump.tenancy.audit.AuditHelper;
import tech.yump.tenancy.core.DataSourceManager;
import tech.yump.tenancy.crypto.CredentialCipher;
import tech.yump.tenancy.metrics.MetricsRecorder;
import tech.yump.tenancy.pool.ClientPool;
import tech.yump.tenancy.pool.HikariTenantClientFactory;
import tech.yump.tenancy.pool.TenantClientFactory;
import tech.yump.tenancy.tenant.ControlPlaneTenantRepository;
import tech.yump.tenancy.tenant.JdbcControlPlaneTenantRepository;
import tech.yump.tenancy.tenant.TenantConfigCache;
import tech.yump.tenancy.tenant.TenantIdMapper;

import java.time.Clock;

/**
 * Wires the data source manager and its collaborators from {@link TenancyProperties}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceManagerConfig {

    private final TenancyProperties tenancyProperties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialCipher credentialCipher() {
        log.info("Initializing credential cipher from tenancy.master.key-hex");
        return new CredentialCipher(tenancyProperties.master().keyHex());
    }

    @Bean
    public MetricsRecorder metricsRecorder() {
        return new MetricsRecorder(tenancyProperties.metrics().enabled());
    }

    @Bean
    public ControlPlaneTenantRepository controlPlaneTenantRepository(JdbcTemplate controlPlaneJdbcTemplate) {
        return new JdbcControlPlaneTenantRepository(controlPlaneJdbcTemplate);
    }

    @Bean
    public TenantConfigCache tenantConfigCache(ControlPlaneTenantRepository repository,
                                               CredentialCipher credentialCipher,
                                               MetricsRecorder metricsRecorder,
                                               Clock clock) {
        return new TenantConfigCache(repository, credentialCipher, metricsRecorder,
                tenancyProperties.pool().configTtl(), clock);
    }

    @Bean
    public TenantClientFactory tenantClientFactory() {
        TenancyProperties.PoolProperties pool = tenancyProperties.pool();
        return new HikariTenantClientFactory(pool.connectionTimeout(), pool.clientTtl());
    }

    @Bean
    public ClientPool clientPool(TenantConfigCache tenantConfigCache,
                                 TenantClientFactory tenantClientFactory,
                                 MetricsRecorder metricsRecorder,
                                 Clock clock,
                                 ObjectProvider<MeterRegistry> meterRegistry) {
        TenancyProperties.PoolProperties pool = tenancyProperties.pool();
        ClientPool clientPool = new ClientPool(tenantConfigCache, tenantClientFactory, metricsRecorder,
                pool.maxClients(), pool.clientTtl(), clock);
        meterRegistry.ifAvailable(registry ->
                metricsRecorder.bindTo(registry, clientPool::size, tenantConfigCache::size));
        return clientPool;
    }

    @Bean
    public TenantIdMapper tenantIdMapper(TenantConfigCache tenantConfigCache) {
        return new TenantIdMapper(tenantConfigCache);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public DataSourceManager dataSourceManager(TenantConfigCache tenantConfigCache,
                                               ClientPool clientPool,
                                               TenantIdMapper tenantIdMapper,
                                               TenantClientFactory tenantClientFactory,
                                               ControlPlaneTenantRepository repository,
                                               CredentialCipher credentialCipher,
                                               MetricsRecorder metricsRecorder,
                                               AuditHelper auditHelper,
                                               Clock clock) {
        return new DataSourceManager(tenantConfigCache, clientPool, tenantIdMapper, tenantClientFactory,
                repository, credentialCipher, metricsRecorder, auditHelper,
                tenancyProperties.pool().cleanupInterval(), clock);
    }
}
