package tech.yump.tenancy.tenant;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Query helper that binds every statement to one tenant's mapped id.
 *
 * <p>Each statement carries a {@code tenant_id = ?} predicate (or column value, for inserts)
 * bound to the {@link MappedTenantId}. Table and column names must be plain identifiers and are
 * always quoted.
 */
@Slf4j
public class TenantScopedJdbc {

    public static final String TENANT_ID_COLUMN = "tenant_id";
    public static final String ID_COLUMN = "id";
    public static final String CREATED_BY_COLUMN = "created_by";
    public static final String UPDATED_BY_COLUMN = "updated_by";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private final JdbcTemplate jdbcTemplate;
    private final MappedTenantId tenantId;

    public TenantScopedJdbc(JdbcTemplate jdbcTemplate, MappedTenantId tenantId) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    }

    public MappedTenantId tenantId() {
        return tenantId;
    }

    /**
     * Selects the tenant's rows matching every filter by equality.
     */
    public List<Map<String, Object>> select(String table, Map<String, ?> filters) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT * FROM " + quoteIdentifier(table) + whereClause(filters, args);
        log.trace("Tenant '{}' select: {}", tenantId.controlPlaneTenantId(), sql);
        return jdbcTemplate.queryForList(sql, args.toArray());
    }

    public List<Map<String, Object>> select(String table) {
        return select(table, Map.of());
    }

    public Optional<Map<String, Object>> findById(String table, Object id) {
        List<Map<String, Object>> rows = select(table, Map.of(ID_COLUMN, id));
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public long count(String table, Map<String, ?> filters) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM " + quoteIdentifier(table) + whereClause(filters, args);
        log.trace("Tenant '{}' count: {}", tenantId.controlPlaneTenantId(), sql);
        Long count = jdbcTemplate.queryForObject(sql, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    /**
     * Inserts one row. Any {@code tenant_id} in {@code values} is replaced with the mapped id.
     *
     * @param userId when not null, stored as both {@code created_by} and {@code updated_by}
     * @return number of rows inserted
     */
    public int insert(String table, Map<String, ?> values, String userId) {
        Map<String, Object> row = new LinkedHashMap<>(values);
        row.keySet().removeIf(TENANT_ID_COLUMN::equalsIgnoreCase);
        row.put(TENANT_ID_COLUMN, tenantId.value());
        if (userId != null) {
            row.put(CREATED_BY_COLUMN, userId);
            row.put(UPDATED_BY_COLUMN, userId);
        }

        String columns = row.keySet().stream()
                .map(TenantScopedJdbc::quoteIdentifier)
                .collect(Collectors.joining(", "));
        String placeholders = row.keySet().stream()
                .map(column -> "?")
                .collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + quoteIdentifier(table) + " (" + columns + ") VALUES (" + placeholders + ")";
        log.trace("Tenant '{}' insert: {}", tenantId.controlPlaneTenantId(), sql);
        return jdbcTemplate.update(sql, row.values().toArray());
    }

    public int insert(String table, Map<String, ?> values) {
        return insert(table, values, null);
    }

    /**
     * Updates the tenant's row with the given id. A {@code tenant_id} in {@code values} is ignored.
     *
     * @param userId when not null, stored as {@code updated_by}
     * @return number of rows updated, 0 if the row belongs to another tenant or does not exist
     */
    public int update(String table, Object id, Map<String, ?> values, String userId) {
        Map<String, Object> changes = new LinkedHashMap<>(values);
        changes.keySet().removeIf(TENANT_ID_COLUMN::equalsIgnoreCase);
        if (userId != null) {
            changes.put(UPDATED_BY_COLUMN, userId);
        }
        if (changes.isEmpty()) {
            throw new IllegalArgumentException("No columns to update in " + table);
        }

        String assignments = changes.keySet().stream()
                .map(column -> quoteIdentifier(column) + " = ?")
                .collect(Collectors.joining(", "));
        List<Object> args = new ArrayList<>(changes.values());
        args.add(id);
        args.add(tenantId.value());
        String sql = "UPDATE " + quoteIdentifier(table) + " SET " + assignments
                + " WHERE " + quoteIdentifier(ID_COLUMN) + " = ? AND " + quoteIdentifier(TENANT_ID_COLUMN) + " = ?";
        log.trace("Tenant '{}' update: {}", tenantId.controlPlaneTenantId(), sql);
        return jdbcTemplate.update(sql, args.toArray());
    }

    public int update(String table, Object id, Map<String, ?> values) {
        return update(table, id, values, null);
    }

    /**
     * @return number of rows deleted, 0 if the row belongs to another tenant or does not exist
     */
    public int delete(String table, Object id) {
        String sql = "DELETE FROM " + quoteIdentifier(table)
                + " WHERE " + quoteIdentifier(ID_COLUMN) + " = ? AND " + quoteIdentifier(TENANT_ID_COLUMN) + " = ?";
        log.trace("Tenant '{}' delete: {}", tenantId.controlPlaneTenantId(), sql);
        return jdbcTemplate.update(sql, id, tenantId.value());
    }

    private String whereClause(Map<String, ?> filters, List<Object> args) {
        StringBuilder where = new StringBuilder(" WHERE ")
                .append(quoteIdentifier(TENANT_ID_COLUMN)).append(" = ?");
        args.add(tenantId.value());
        filters.forEach((column, value) -> {
            if (TENANT_ID_COLUMN.equalsIgnoreCase(column)) {
                throw new IllegalArgumentException("tenant_id cannot be used as a filter; it is always bound to the mapped tenant id");
            }
            where.append(" AND ").append(quoteIdentifier(column)).append(" = ?");
            args.add(value);
        });
        return where.toString();
    }

    /**
     * Validates a table or column name and quotes it as a PostgreSQL identifier.
     *
     * @throws IllegalArgumentException if the name is not a plain identifier
     */
    static String quoteIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return "\"" + identifier + "\"";
    }
}
