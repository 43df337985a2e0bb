package tech.yump.tenancy.tenant;

import java.util.Objects;

/**
 * A tenant's identifier inside its own isolated data source.
 *
 * <p>Only {@link TenantIdMapper} creates instances, so a value of this type has always been
 * resolved from the control plane and can never be a raw control-plane id passed by mistake.
 */
public final class MappedTenantId {

    private final String controlPlaneTenantId;
    private final String value;

    MappedTenantId(String controlPlaneTenantId, String value) {
        this.controlPlaneTenantId = Objects.requireNonNull(controlPlaneTenantId, "controlPlaneTenantId");
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * The control-plane id this mapping was resolved from.
     */
    public String controlPlaneTenantId() {
        return controlPlaneTenantId;
    }

    public String value() {
        return value;
    }

    public boolean isIdentity() {
        return value.equals(controlPlaneTenantId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MappedTenantId that)) return false;
        return controlPlaneTenantId.equals(that.controlPlaneTenantId) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(controlPlaneTenantId, value);
    }

    @Override
    public String toString() {
        return value;
    }
}
