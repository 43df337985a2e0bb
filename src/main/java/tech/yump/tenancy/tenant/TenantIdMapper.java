package tech.yump.tenancy.tenant;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a control-plane tenant id to the id the tenant's rows carry in its own data source.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantIdMapper {

    private final TenantConfigCache configCache;

    /**
     * @throws TenantNotFoundException if the control plane has no row for the tenant
     */
    public MappedTenantId getTenantIdInDataSource(String tenantId) {
        TenantConnectionConfig config = configCache.get(tenantId);
        MappedTenantId mapped = new MappedTenantId(tenantId, config.tenantIdInDataSource());
        if (!mapped.isIdentity()) {
            log.debug("Tenant '{}' maps to '{}' in its data source", tenantId, mapped.value());
        }
        return mapped;
    }
}
