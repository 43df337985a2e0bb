package tech.yump.tenancy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Configuration properties for the tenant data source manager under the 'tenancy' prefix.
 */
@ConfigurationProperties(prefix = "tenancy")
@Validated
public record TenancyProperties(

        @Valid
        @NotNull(message = "Master key configuration (tenancy.master) is required.")
        MasterKeyProperties master,

        @Valid
        @NotNull(message = "Control-plane database configuration (tenancy.control-plane) is required.")
        ControlPlaneProperties controlPlane,

        @Valid
        PoolProperties pool,

        @Valid
        MetricsProperties metrics,

        @Valid
        AuthProperties auth
) {

    public TenancyProperties {
        if (pool == null) {
            pool = PoolProperties.defaults();
        }
        if (metrics == null) {
            metrics = new MetricsProperties(true);
        }
        if (auth == null) {
            auth = new AuthProperties(null);
        }
    }

    @Validated
    public record MasterKeyProperties(
            @NotBlank(message = "Master key (tenancy.master.key-hex) must be provided.")
            @Pattern(regexp = "^[0-9a-fA-F]{64}$",
                    message = "Master key (tenancy.master.key-hex) must be 64 hexadecimal characters (32 bytes).")
            String keyHex
    ) {}

    @Validated
    public record ControlPlaneProperties(
            @NotBlank(message = "Control-plane connection URL (tenancy.control-plane.connection-url) must be provided.")
            String connectionUrl,

            @NotBlank(message = "Control-plane username (tenancy.control-plane.username) must be provided.")
            String username,

            @NotNull(message = "Control-plane password (tenancy.control-plane.password) must be provided.")
            char[] password,

            @Min(value = 1, message = "Control-plane pool size (tenancy.control-plane.max-pool-size) must be at least 1.")
            Integer maxPoolSize
    ) {
        public ControlPlaneProperties {
            if (maxPoolSize == null) {
                maxPoolSize = 10;
            }
        }
    }

    /**
     * Limits and lifetimes of the tenant client pool and config cache.
     */
    @Validated
    public record PoolProperties(
            @Min(value = 1, message = "tenancy.pool.max-clients must be at least 1.")
            Integer maxClients,
            Duration clientTtl,
            Duration configTtl,
            Duration cleanupInterval,
            Duration connectionTimeout
    ) {
        public static final int DEFAULT_MAX_CLIENTS = 50;
        public static final Duration DEFAULT_CLIENT_TTL = Duration.ofHours(1);
        public static final Duration DEFAULT_CONFIG_TTL = Duration.ofMinutes(5);
        public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(10);
        public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);

        public PoolProperties {
            if (maxClients == null) {
                maxClients = DEFAULT_MAX_CLIENTS;
            }
            if (clientTtl == null) {
                clientTtl = DEFAULT_CLIENT_TTL;
            }
            if (configTtl == null) {
                configTtl = DEFAULT_CONFIG_TTL;
            }
            if (cleanupInterval == null) {
                cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
            }
            if (connectionTimeout == null) {
                connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
            }
        }

        public static PoolProperties defaults() {
            return new PoolProperties(null, null, null, null, null);
        }

        @AssertTrue(message = "tenancy.pool durations (client-ttl, config-ttl, cleanup-interval, connection-timeout) must be positive.")
        public boolean isDurationsValid() {
            return isPositive(clientTtl) && isPositive(configTtl)
                    && isPositive(cleanupInterval) && isPositive(connectionTimeout);
        }

        private static boolean isPositive(Duration duration) {
            return duration != null && !duration.isNegative() && !duration.isZero();
        }
    }

    @Validated
    public record MetricsProperties(Boolean enabled) {
        public MetricsProperties {
            if (enabled == null) {
                enabled = true;
            }
        }
    }

    @Validated
    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {

        public AuthProperties {
            if (staticTokens == null) {
                staticTokens = new StaticTokenAuthProperties(false, null);
            }
        }

        /**
         * Admin tokens accepted in the {@code X-Admin-Token} header.
         */
        @Validated
        public record StaticTokenAuthProperties(
                boolean enabled,
                List<@NotBlank(message = "Static token value cannot be blank") String> tokens
        ) {
            public StaticTokenAuthProperties {
                if (tokens == null) {
                    tokens = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static tokens (tenancy.auth.static-tokens.tokens) cannot be empty when static token auth is enabled.")
            public boolean isTokensValid() {
                return !this.enabled() || !this.tokens().isEmpty();
            }
        }
    }
}
