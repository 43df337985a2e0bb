package tech.yump.tenancy.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.tenancy.auth.StaticTokenAuthFilter;

@Configuration
public class OpenApiConfig {

    static final String SECURITY_SCHEME_NAME = "AdminTokenAuth";

    @Bean
    public OpenAPI tenancyOpenAPI() {
        SecurityScheme adminTokenScheme = new SecurityScheme()
                .name(StaticTokenAuthFilter.ADMIN_TOKEN_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Static admin token ('" + StaticTokenAuthFilter.ADMIN_TOKEN_HEADER
                        + "') required for the /v1/admin endpoints.");

        return new OpenAPI()
                .info(new Info()
                        .title("Tenant Data Source Manager")
                        .description("Diagnostics and administration of per-tenant data sources"))
                .components(new Components().addSecuritySchemes(SECURITY_SCHEME_NAME, adminTokenScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
