package tech.yump.tenancy.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.tenancy.audit.AuditBackend;
import tech.yump.tenancy.auth.StaticTokenAuthFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final TenancyProperties tenancyProperties;
  private final AuditBackend auditBackend;

  @Bean
  public StaticTokenAuthFilter staticTokenAuthFilter() {
    return new StaticTokenAuthFilter(tenancyProperties.auth().staticTokens(), auditBackend);
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, StaticTokenAuthFilter staticTokenAuthFilter) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

    if (tenancyProperties.auth().staticTokens().enabled()) {
      log.info("Configuring Spring Security for static admin token authentication.");
      http
              .addFilterBefore(staticTokenAuthFilter, UsernamePasswordAuthenticationFilter.class)
              .authorizeHttpRequests(authz -> authz
                      .requestMatchers("/").permitAll()
                      .requestMatchers("/actuator/health/**", "/actuator/health").permitAll()
                      .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                      .requestMatchers("/v1/admin/**").hasAuthority(StaticTokenAuthFilter.ADMIN_AUTHORITY)
                      .anyRequest().authenticated()
              );
    } else {
      log.warn("Static admin token authentication is disabled via configuration (tenancy.auth.static-tokens.enabled=false). The admin API is accessible without authentication. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
