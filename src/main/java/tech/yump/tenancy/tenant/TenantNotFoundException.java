package tech.yump.tenancy.tenant;

import tech.yump.tenancy.core.DataSourceManagerException;

/**
 * Exception thrown when the control plane has no row for a tenant identifier.
 */
public class TenantNotFoundException extends DataSourceManagerException {
    public TenantNotFoundException(String tenantId) {
        super("Tenant not found: " + tenantId);
    }
}
