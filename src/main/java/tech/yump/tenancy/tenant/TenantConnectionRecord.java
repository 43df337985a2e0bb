package tech.yump.tenancy.tenant;

/**
 * Raw tenant row as stored in the control-plane {@code tenants} table.
 * Secrets are still encrypted; see {@link TenantConnectionConfig} for the decrypted form.
 */
public record TenantConnectionRecord(
        String tenantId,
        String dataSourceUrl,
        String encryptedAnonSecret,
        String encryptedServiceSecret,
        String anonUsername,
        String serviceUsername,
        String region,
        String tenantIdInDataSource,
        PoolConfig poolConfig
) {
    @Override
    public String toString() {
        return "TenantConnectionRecord[" +
                "tenantId='" + tenantId + '\'' +
                ", dataSourceUrl='" + dataSourceUrl + '\'' +
                ", region='" + region + '\'' +
                ", tenantIdInDataSource='" + tenantIdInDataSource + '\'' +
                ", poolConfig=" + poolConfig +
                ']';
    }
}
