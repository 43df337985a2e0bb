package tech.yump.tenancy.pool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import tech.yump.tenancy.tenant.MappedTenantId;
import tech.yump.tenancy.tenant.TenantScopedJdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Handle to one tenant's isolated data source, bound to a single access role.
 *
 * <p>Handles cached by {@link ClientPool} are owned by the pool, which closes them on eviction.
 * Tenant data is only reachable through {@link #scoped(MappedTenantId)}.
 */
@Slf4j
public class TenantClient implements AutoCloseable {

    static final String PROBE_SQL = "SELECT 1";

    private final String tenantId;
    private final ClientRole role;
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    public TenantClient(String tenantId, ClientRole role, DataSource dataSource) {
        this.tenantId = tenantId;
        this.role = role;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public String tenantId() {
        return tenantId;
    }

    public ClientRole role() {
        return role;
    }

    /**
     * Returns the query helper scoped to the tenant's mapped id.
     *
     * @throws IllegalArgumentException if the mapped id belongs to another tenant
     */
    public TenantScopedJdbc scoped(MappedTenantId mappedTenantId) {
        if (!tenantId.equals(mappedTenantId.controlPlaneTenantId())) {
            log.error("Refusing to scope client of tenant '{}' with mapped id of tenant '{}'",
                    tenantId, mappedTenantId.controlPlaneTenantId());
            throw new IllegalArgumentException("Mapped tenant id does not belong to tenant " + tenantId);
        }
        return new TenantScopedJdbc(jdbcTemplate, mappedTenantId);
    }

    /**
     * Opens one connection and asks the driver whether it is usable.
     */
    public boolean isValid(int timeoutSeconds) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(timeoutSeconds);
        }
    }

    /**
     * Runs a trivial round-trip query.
     *
     * @throws org.springframework.dao.DataAccessException if the query fails
     */
    public void probe() {
        jdbcTemplate.queryForObject(PROBE_SQL, Integer.class);
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
                log.debug("Closed client {}-{}", tenantId, role);
            } catch (Exception e) {
                log.warn("Failed to close client {}-{}: {}", tenantId, role, e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "TenantClient[" + tenantId + "-" + role.name().toLowerCase() + "]";
    }
}
