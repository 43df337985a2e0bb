package tech.yump.tenancy.pool;

/**
 * Pool key: one cached client per tenant and role.
 */
public record ClientKey(String tenantId, ClientRole role) {

    @Override
    public String toString() {
        return tenantId + "-" + role.name().toLowerCase();
    }
}
