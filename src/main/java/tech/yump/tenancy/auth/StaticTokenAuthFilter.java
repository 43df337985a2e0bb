package tech.yump.tenancy.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.tenancy.audit.AuditBackend;
import tech.yump.tenancy.audit.AuditEvent;
import tech.yump.tenancy.config.TenancyProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates admin requests carrying one of the configured static tokens in {@value #ADMIN_TOKEN_HEADER}.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";
  public static final String ADMIN_AUTHORITY = "ROLE_TENANCY_ADMIN";

  private final boolean staticAuthEnabled;
  private final List<String> tokens;
  private final List<String> publicPaths = List.of("/");
  private final AuditBackend auditBackend;

  public StaticTokenAuthFilter(
          TenancyProperties.AuthProperties.StaticTokenAuthProperties staticTokenProps,
          AuditBackend auditBackend
  ) {
    this.staticAuthEnabled = Optional.ofNullable(staticTokenProps)
            .map(TenancyProperties.AuthProperties.StaticTokenAuthProperties::enabled)
            .orElse(false);

    this.tokens = Optional.ofNullable(staticTokenProps)
            .map(TenancyProperties.AuthProperties.StaticTokenAuthProperties::tokens)
            .orElse(Collections.emptyList());

    this.auditBackend = auditBackend;

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Tokens count: {}",
            this.staticAuthEnabled, this.tokens.size());
    if (this.staticAuthEnabled && this.tokens.isEmpty()) {
      log.warn("Static token authentication is enabled but no tokens are configured!");
    }
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      final String tokenHeader = request.getHeader(ADMIN_TOKEN_HEADER);

      if (!StringUtils.hasText(tokenHeader) || SecurityContextHolder.getContext().getAuthentication() != null) {
        log.trace("No {} header found or authentication already present for {}. Proceeding.",
                ADMIN_TOKEN_HEADER, request.getRequestURI());
        filterChain.doFilter(request, response);
        return;
      }

      final String providedToken = tokenHeader.trim();
      Optional<String> matched = tokens.stream()
              .filter(token -> constantTimeEquals(token, providedToken))
              .findFirst();

      if (matched.isPresent()) {
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principalFor(matched.get()),
                null,
                List.of(new SimpleGrantedAuthority(ADMIN_AUTHORITY))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.info("Authenticated admin request with static token for URI: {}", request.getRequestURI());

        logAuditEvent("success", authentication.getName(), request, null);
      } else {
        log.warn("Invalid or unknown admin token received for URI: {}", request.getRequestURI());
        logAuditEvent("failure", null, request, Map.of("reason", "invalid_token"));
        // Continue unauthenticated; the authorization rules reject the request.
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  /**
   * Principal name for a token. Never the token itself, which would otherwise end up in audit logs.
   */
  static String principalFor(String token) {
    String suffix = token.length() > 4 ? token.substring(token.length() - 4) : "****";
    return "admin-token-..." + suffix;
  }

  private static boolean constantTimeEquals(String expected, String provided) {
    return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            provided.getBytes(StandardCharsets.UTF_8));
  }

  private void logAuditEvent(String outcome, String principal, HttpServletRequest request, Map<String, Object> data) {
    try {
      AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
              .principal(principal)
              .sourceAddress(request.getRemoteAddr())
              .build();

      AuditEvent.RequestInfo requestInfo = AuditEvent.RequestInfo.builder()
              .requestId((String) request.getAttribute(REQUEST_ID_ATTR))
              .httpMethod(request.getMethod())
              .path(request.getRequestURI())
              .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
              .build();

      AuditEvent event = AuditEvent.builder()
              .timestamp(Instant.now())
              .type("auth")
              .action("token_validation")
              .outcome(outcome)
              .authInfo(authInfo)
              .requestInfo(requestInfo)
              .data(data)
              .build();

      auditBackend.logEvent(event);

    } catch (Exception e) {
      log.error("Failed to log audit event in StaticTokenAuthFilter: {}", e.getMessage(), e);
    }
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    String path = request.getRequestURI();
    if (!staticAuthEnabled) {
      log.trace("Skipping filter as static auth is disabled.");
      return true;
    }
    if (publicPaths.contains(path)) {
      log.trace("Path {} is configured as public, skipping StaticTokenAuthFilter.", path);
      return true;
    }
    return false;
  }
}
