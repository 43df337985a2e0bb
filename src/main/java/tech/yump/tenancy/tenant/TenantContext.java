package tech.yump.tenancy.tenant;

import tech.yump.tenancy.pool.TenantClient;

/**
 * Everything a request needs to work against one tenant's data source.
 */
public record TenantContext(TenantClient client, String tenantId, MappedTenantId mappedTenantId) {

    public TenantScopedJdbc scoped() {
        return client.scoped(mappedTenantId);
    }
}
