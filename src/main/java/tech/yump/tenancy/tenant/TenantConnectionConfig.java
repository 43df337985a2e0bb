package tech.yump.tenancy.tenant;

import tech.yump.tenancy.pool.ClientRole;

/**
 * Decrypted, immutable connection configuration of a tenant's isolated data source.
 *
 * @param tenantId             control-plane tenant id
 * @param dataSourceUrl        JDBC URL of the tenant's data source
 * @param anonSecret           password of the restricted login
 * @param serviceSecret        password of the service-level login
 * @param anonUsername         restricted login name
 * @param serviceUsername      service-level login name
 * @param region               hosting region, may be null
 * @param tenantIdInDataSource identifier of the tenant inside its own data source
 * @param poolConfig           pool sizing for clients built from this config
 */
public record TenantConnectionConfig(
        String tenantId,
        String dataSourceUrl,
        String anonSecret,
        String serviceSecret,
        String anonUsername,
        String serviceUsername,
        String region,
        String tenantIdInDataSource,
        PoolConfig poolConfig
) {

    public String usernameFor(ClientRole role) {
        return role == ClientRole.SERVICE ? serviceUsername : anonUsername;
    }

    public String secretFor(ClientRole role) {
        return role == ClientRole.SERVICE ? serviceSecret : anonSecret;
    }

    @Override
    public String toString() {
        // Secrets stay out of logs
        return "TenantConnectionConfig[" +
                "tenantId='" + tenantId + '\'' +
                ", dataSourceUrl='" + dataSourceUrl + '\'' +
                ", anonSecret=******" +
                ", serviceSecret=******" +
                ", anonUsername='" + anonUsername + '\'' +
                ", serviceUsername='" + serviceUsername + '\'' +
                ", region='" + region + '\'' +
                ", tenantIdInDataSource='" + tenantIdInDataSource + '\'' +
                ", poolConfig=" + poolConfig +
                ']';
    }
}
