package tech.yump.tenancy.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import tech.yump.tenancy.audit.AuditBackend;
import tech.yump.tenancy.audit.AuditEvent;
import tech.yump.tenancy.config.TenancyProperties;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class StaticTokenAuthFilterTest {

    private static final String VALID_TOKEN = "ops-token-7f3a";
    private static final String OTHER_VALID_TOKEN = "oncall-token-91bd";
    private static final String INVALID_TOKEN = "not-a-token";

    @Mock
    private AuditBackend mockAuditBackend;
    @Mock
    private FilterChain mockFilterChain;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    private MockHttpServletRequest mockRequest;
    private MockHttpServletResponse mockResponse;
    private StaticTokenAuthFilter filter;

    @BeforeEach
    void setUp() {
        SecurityContextHolder.clearContext();
        mockRequest = new MockHttpServletRequest();
        mockResponse = new MockHttpServletResponse();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private StaticTokenAuthFilter filter(boolean enabled, List<String> tokens) {
        return new StaticTokenAuthFilter(
                new TenancyProperties.AuthProperties.StaticTokenAuthProperties(enabled, tokens), mockAuditBackend);
    }

    @Test
    @DisplayName("doFilterInternal: No token header proceeds unauthenticated without auditing")
    void doFilterInternal_whenNoTokenHeader_shouldProceedWithoutAuth() throws ServletException, IOException {
        filter = filter(true, List.of(VALID_TOKEN));

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(mockRequest.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR)).isNotNull();
        assertThat(MDC.get(StaticTokenAuthFilter.MDC_REQUEST_ID_KEY)).isNull();
    }

    @Test
    @DisplayName("doFilterInternal: Blank token header proceeds unauthenticated")
    void doFilterInternal_whenBlankTokenHeader_shouldProceedWithoutAuth() throws ServletException, IOException {
        filter = filter(true, List.of(VALID_TOKEN));
        mockRequest.addHeader(StaticTokenAuthFilter.ADMIN_TOKEN_HEADER, "   ");

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("doFilterInternal: Unknown token is audited as a failure and left unauthenticated")
    void doFilterInternal_whenInvalidToken_shouldLogFailureAndProceed() throws ServletException, IOException {
        filter = filter(true, List.of(VALID_TOKEN));
        mockRequest.addHeader(StaticTokenAuthFilter.ADMIN_TOKEN_HEADER, INVALID_TOKEN);
        mockRequest.setMethod("GET");
        mockRequest.setRequestURI("/v1/admin/datasources/stats");
        mockRequest.setRemoteAddr("1.2.3.4");

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.type()).isEqualTo("auth");
        assertThat(event.action()).isEqualTo("token_validation");
        assertThat(event.outcome()).isEqualTo("failure");
        assertThat(event.authInfo().principal()).isNull();
        assertThat(event.authInfo().sourceAddress()).isEqualTo("1.2.3.4");
        assertThat(event.requestInfo().httpMethod()).isEqualTo("GET");
        assertThat(event.requestInfo().path()).isEqualTo("/v1/admin/datasources/stats");
        assertThat(event.data()).isEqualTo(Map.of("reason", "invalid_token"));
    }

    @Test
    @DisplayName("doFilterInternal: Valid token authenticates as admin with a masked principal")
    void doFilterInternal_whenValidToken_shouldSetAuthLogSuccessAndProceed() throws ServletException, IOException {
        filter = filter(true, List.of(VALID_TOKEN, OTHER_VALID_TOKEN));
        mockRequest.addHeader(StaticTokenAuthFilter.ADMIN_TOKEN_HEADER, " " + OTHER_VALID_TOKEN + " ");
        mockRequest.setMethod("PUT");
        mockRequest.setRequestURI("/v1/admin/tenants/acme/credentials");
        mockRequest.setRemoteAddr("10.0.0.5");

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isInstanceOf(UsernamePasswordAuthenticationToken.class);
        assertThat(auth.isAuthenticated()).isTrue();
        assertThat(auth.getPrincipal()).isEqualTo("admin-token-...91bd");
        assertThat(auth.getCredentials()).isNull();
        assertThat(auth.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactly(StaticTokenAuthFilter.ADMIN_AUTHORITY);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.outcome()).isEqualTo("success");
        assertThat(event.authInfo().principal()).isEqualTo("admin-token-...91bd");
        assertThat(event.authInfo().sourceAddress()).isEqualTo("10.0.0.5");
        assertThat(event.requestInfo().requestId())
                .isEqualTo(mockRequest.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR));
        assertThat(event.toString()).doesNotContain(OTHER_VALID_TOKEN);
    }

    @Test
    @DisplayName("doFilterInternal: Existing authentication is left untouched")
    void doFilterInternal_whenAlreadyAuthenticated_shouldSkipAndProceed() throws ServletException, IOException {
        Authentication existingAuth = new UsernamePasswordAuthenticationToken(
                "pre-authenticated-user", null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
        SecurityContextHolder.getContext().setAuthentication(existingAuth);
        filter = filter(true, List.of(VALID_TOKEN));
        mockRequest.addHeader(StaticTokenAuthFilter.ADMIN_TOKEN_HEADER, VALID_TOKEN);

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isSameAs(existingAuth);
    }

    @Test
    @DisplayName("shouldNotFilter: Admin paths are filtered, the root path is not")
    void shouldNotFilter_whenEnabled() {
        filter = filter(true, List.of(VALID_TOKEN));

        mockRequest.setRequestURI("/v1/admin/datasources/stats");
        assertThat(filter.shouldNotFilter(mockRequest)).isFalse();

        mockRequest.setRequestURI("/");
        assertThat(filter.shouldNotFilter(mockRequest)).isTrue();
    }

    @Test
    @DisplayName("shouldNotFilter: Nothing is filtered when static auth is disabled")
    void shouldNotFilter_whenDisabled_shouldReturnTrue() {
        filter = filter(false, Collections.emptyList());

        mockRequest.setRequestURI("/v1/admin/datasources/stats");
        assertThat(filter.shouldNotFilter(mockRequest)).isTrue();
    }

    @Test
    @DisplayName("principalFor: Short tokens are fully masked")
    void principalFor_masksToken() {
        assertThat(StaticTokenAuthFilter.principalFor("abcdefgh")).isEqualTo("admin-token-...efgh");
        assertThat(StaticTokenAuthFilter.principalFor("abc")).isEqualTo("admin-token-...****");
    }
}
