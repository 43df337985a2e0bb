package tech.yump.tenancy.pool;

import tech.yump.tenancy.tenant.TenantConnectionConfig;

/**
 * Builds client handles for a tenant's isolated data source.
 */
public interface TenantClientFactory {

    /**
     * Creates a new client connected with the credentials of the given role.
     * The caller owns the returned client and must close it.
     *
     * @throws tech.yump.tenancy.core.DataSourceManagerException if the client cannot be created
     */
    TenantClient create(TenantConnectionConfig config, ClientRole role);
}
