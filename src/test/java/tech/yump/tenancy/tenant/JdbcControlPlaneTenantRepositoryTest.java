package tech.yump.tenancy.tenant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import tech.yump.tenancy.core.DataSourceManagerException;
import tech.yump.tenancy.core.TenantConfigurationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcControlPlaneTenantRepositoryTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcControlPlaneTenantRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:control-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
                "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("control-plane-schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        repository = new JdbcControlPlaneTenantRepository(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.execute("SHUTDOWN");
    }

    private void insertTenant(String id, Integer poolMin, Integer poolMax, String mappedId) {
        jdbcTemplate.update("""
                INSERT INTO tenants (id, data_source_url, data_source_anon_key, data_source_service_key,
                                     data_source_anon_username, data_source_service_username,
                                     data_source_region, tenant_id_in_data_source, pool_min, pool_max)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                id, "jdbc:postgresql://db/" + id, "enc-anon", "enc-service",
                "anon_user", "service_user", "eu-west-1", mappedId, poolMin, poolMax);
    }

    @Test
    @DisplayName("Loads every column of the tenant row")
    void findConnectionRecord_mapsRow() {
        insertTenant("acme", 1, 8, "acme-internal");

        TenantConnectionRecord record = repository.findConnectionRecord("acme").orElseThrow();

        assertThat(record.tenantId()).isEqualTo("acme");
        assertThat(record.dataSourceUrl()).isEqualTo("jdbc:postgresql://db/acme");
        assertThat(record.encryptedAnonSecret()).isEqualTo("enc-anon");
        assertThat(record.encryptedServiceSecret()).isEqualTo("enc-service");
        assertThat(record.anonUsername()).isEqualTo("anon_user");
        assertThat(record.serviceUsername()).isEqualTo("service_user");
        assertThat(record.region()).isEqualTo("eu-west-1");
        assertThat(record.tenantIdInDataSource()).isEqualTo("acme-internal");
        assertThat(record.poolConfig()).isEqualTo(new PoolConfig(1, 8));
    }

    @Test
    @DisplayName("Missing pool columns fall back to the default pool config")
    void findConnectionRecord_defaultsPoolConfig() {
        insertTenant("acme", null, null, null);

        TenantConnectionRecord record = repository.findConnectionRecord("acme").orElseThrow();

        assertThat(record.poolConfig()).isEqualTo(PoolConfig.DEFAULT);
        assertThat(record.tenantIdInDataSource()).isNull();
    }

    @Test
    @DisplayName("Pool config with min above max is a configuration error")
    void findConnectionRecord_invalidPoolConfig() {
        insertTenant("acme", 9, 2, null);

        assertThatThrownBy(() -> repository.findConnectionRecord("acme"))
                .isInstanceOf(TenantConfigurationException.class);
    }

    @Test
    @DisplayName("Unknown tenant yields an empty result")
    void findConnectionRecord_unknownTenant() {
        assertThat(repository.findConnectionRecord("ghost")).isEmpty();
    }

    @Test
    @DisplayName("updateEncryptedSecrets replaces both secrets and reports whether a row matched")
    void updateEncryptedSecrets() {
        insertTenant("acme", null, null, null);

        assertThat(repository.updateEncryptedSecrets("acme", "new-anon", "new-service")).isTrue();
        assertThat(repository.updateEncryptedSecrets("ghost", "x", "y")).isFalse();

        TenantConnectionRecord record = repository.findConnectionRecord("acme").orElseThrow();
        assertThat(record.encryptedAnonSecret()).isEqualTo("new-anon");
        assertThat(record.encryptedServiceSecret()).isEqualTo("new-service");
    }

    @Test
    @DisplayName("Database errors are wrapped in DataSourceManagerException")
    void findConnectionRecord_wrapsDataAccessErrors() {
        jdbcTemplate.execute("DROP TABLE tenants");

        assertThatThrownBy(() -> repository.findConnectionRecord("acme"))
                .isInstanceOf(DataSourceManagerException.class)
                .hasMessageContaining("acme");
    }
}
