package tech.yump.tenancy.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.Arrays;

/**
 * Primary data source pointing at the control-plane database that holds the {@code tenants} table.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ControlPlaneDataSourceConfig {

    private final TenancyProperties tenancyProperties;

    @Bean(destroyMethod = "close")
    @Primary
    public HikariDataSource dataSource() {
        log.info("Manually configuring control-plane Hikari DataSource...");

        TenancyProperties.ControlPlaneProperties props = tenancyProperties.controlPlane();
        if (props == null) {
            log.error("Control-plane configuration (tenancy.control-plane) is missing. Cannot configure DataSource.");
            throw new IllegalStateException("Missing control-plane configuration for DataSource.");
        }

        // Local copy, cleared once Hikari holds the password.
        char[] passwordChars = props.password() != null ? props.password().clone() : null;
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(props.connectionUrl());
            config.setUsername(props.username());
            config.setPassword(passwordChars != null ? new String(passwordChars) : null);
            config.setPoolName("ControlPlanePool");
            config.setMaximumPoolSize(props.maxPoolSize());
            config.setMinimumIdle(Math.min(2, props.maxPoolSize()));

            log.info("Creating HikariDataSource for URL: {}, User: {}", config.getJdbcUrl(), config.getUsername());
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("Control-plane DataSource configured successfully.");
            return dataSource;
        } catch (RuntimeException e) {
            log.error("Failed to configure control-plane DataSource: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to configure control-plane DataSource", e);
        } finally {
            if (passwordChars != null) {
                Arrays.fill(passwordChars, '\0');
                log.debug("Local copy of control-plane password cleared from memory.");
            }
        }
    }

    @Bean
    public JdbcTemplate controlPlaneJdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }
}
