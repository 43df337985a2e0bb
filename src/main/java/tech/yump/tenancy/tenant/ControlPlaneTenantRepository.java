package tech.yump.tenancy.tenant;

import java.util.Optional;

/**
 * Access to tenant connection rows in the control-plane database.
 */
public interface ControlPlaneTenantRepository {

    /**
     * Loads the raw, still encrypted, connection row of a tenant.
     *
     * @param tenantId the control-plane tenant id
     * @return the row, or empty if the tenant does not exist
     */
    Optional<TenantConnectionRecord> findConnectionRecord(String tenantId);

    /**
     * Replaces the encrypted secrets of a tenant.
     *
     * @return true if a row was updated
     */
    boolean updateEncryptedSecrets(String tenantId, String encryptedAnonSecret, String encryptedServiceSecret);
}
