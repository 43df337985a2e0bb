package tech.yump.tenancy.tenant;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import tech.yump.tenancy.core.DataSourceManagerException;
import tech.yump.tenancy.core.TenantConfigurationException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Reads tenant connection rows from the control-plane {@code tenants} table.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcControlPlaneTenantRepository implements ControlPlaneTenantRepository {

    static final String SELECT_CONNECTION_SQL = """
            SELECT id, data_source_url, data_source_anon_key, data_source_service_key,
                   data_source_anon_username, data_source_service_username,
                   data_source_region, tenant_id_in_data_source, pool_min, pool_max
              FROM tenants
             WHERE id = ?
            """;

    static final String UPDATE_SECRETS_SQL = """
            UPDATE tenants
               SET data_source_anon_key = ?, data_source_service_key = ?
             WHERE id = ?
            """;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<TenantConnectionRecord> rowMapper = this::mapRow;

    @Override
    public Optional<TenantConnectionRecord> findConnectionRecord(String tenantId) {
        log.debug("Loading connection row for tenant '{}' from control plane", tenantId);
        try {
            List<TenantConnectionRecord> rows = jdbcTemplate.query(SELECT_CONNECTION_SQL, rowMapper, tenantId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Control-plane lookup failed for tenant '{}': {}", tenantId, e.getMessage(), e);
            throw new DataSourceManagerException("Failed to load connection configuration for tenant: " + tenantId, e);
        }
    }

    @Override
    public boolean updateEncryptedSecrets(String tenantId, String encryptedAnonSecret, String encryptedServiceSecret) {
        try {
            int updated = jdbcTemplate.update(UPDATE_SECRETS_SQL, encryptedAnonSecret, encryptedServiceSecret, tenantId);
            log.info("Updated encrypted secrets for tenant '{}' ({} row(s))", tenantId, updated);
            return updated > 0;
        } catch (DataAccessException e) {
            log.error("Control-plane update failed for tenant '{}': {}", tenantId, e.getMessage(), e);
            throw new DataSourceManagerException("Failed to update secrets for tenant: " + tenantId, e);
        }
    }

    private TenantConnectionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new TenantConnectionRecord(
                rs.getString("id"),
                rs.getString("data_source_url"),
                rs.getString("data_source_anon_key"),
                rs.getString("data_source_service_key"),
                rs.getString("data_source_anon_username"),
                rs.getString("data_source_service_username"),
                rs.getString("data_source_region"),
                rs.getString("tenant_id_in_data_source"),
                mapPoolConfig(rs)
        );
    }

    private PoolConfig mapPoolConfig(ResultSet rs) throws SQLException {
        int min = rs.getInt("pool_min");
        boolean minMissing = rs.wasNull();
        int max = rs.getInt("pool_max");
        boolean maxMissing = rs.wasNull();
        if (minMissing || maxMissing) {
            return PoolConfig.DEFAULT;
        }
        try {
            return new PoolConfig(min, max);
        } catch (IllegalArgumentException e) {
            throw new TenantConfigurationException(
                    "Invalid pool config for tenant '" + rs.getString("id") + "': " + e.getMessage(), e);
        }
    }
}
