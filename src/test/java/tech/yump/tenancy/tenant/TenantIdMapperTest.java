package tech.yump.tenancy.tenant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantIdMapperTest {

    @Mock
    private TenantConfigCache configCache;

    @InjectMocks
    private TenantIdMapper mapper;

    private static TenantConnectionConfig config(String tenantId, String mappedId) {
        return new TenantConnectionConfig(tenantId, "jdbc:postgresql://db/" + tenantId, "a", "s",
                null, null, null, mappedId, PoolConfig.DEFAULT);
    }

    @Test
    @DisplayName("Returns the id the tenant uses inside its own data source")
    void getTenantIdInDataSource_mapped() {
        when(configCache.get("acme")).thenReturn(config("acme", "7f3c-acme"));

        MappedTenantId mapped = mapper.getTenantIdInDataSource("acme");

        assertThat(mapped.value()).isEqualTo("7f3c-acme");
        assertThat(mapped.controlPlaneTenantId()).isEqualTo("acme");
        assertThat(mapped.isIdentity()).isFalse();
    }

    @Test
    @DisplayName("Identity mapping when the config carries the control-plane id")
    void getTenantIdInDataSource_identity() {
        when(configCache.get("acme")).thenReturn(config("acme", "acme"));

        assertThat(mapper.getTenantIdInDataSource("acme").isIdentity()).isTrue();
    }

    @Test
    @DisplayName("Unknown tenant propagates TenantNotFoundException")
    void getTenantIdInDataSource_unknownTenant() {
        when(configCache.get("ghost")).thenThrow(new TenantNotFoundException("ghost"));

        assertThatThrownBy(() -> mapper.getTenantIdInDataSource("ghost"))
                .isInstanceOf(TenantNotFoundException.class);
    }
}
