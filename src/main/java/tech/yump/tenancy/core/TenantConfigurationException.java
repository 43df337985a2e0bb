package tech.yump.tenancy.core;

/**
 * Thrown when the master key or a tenant's control-plane configuration is unusable.
 * Requires operator intervention; callers must not retry automatically.
 */
public class TenantConfigurationException extends DataSourceManagerException {
    public TenantConfigurationException(String message) {
        super(message);
    }

    public TenantConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
