package tech.yump.tenancy.audit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.tenancy.auth.StaticTokenAuthFilter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuditHelperTest {

    private static final String TEST_PRINCIPAL = "admin-token-...7f3a";
    private static final String TEST_IP = "192.168.0.100";

    @Mock
    private AuditBackend mockAuditBackend;
    @Mock
    private SecurityContext mockSecurityContext;

    @InjectMocks
    private AuditHelper auditHelper;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    private final String testRequestId = UUID.randomUUID().toString();
    private MockedStatic<RequestContextHolder> mockedRequestContextHolder;
    private MockedStatic<SecurityContextHolder> mockedSecurityContextHolder;

    @BeforeEach
    void setUp() {
        MockHttpServletRequest mockRequest = new MockHttpServletRequest();
        mockRequest.setRemoteAddr(TEST_IP);
        mockRequest.setRequestURI("/v1/admin/tenants/acme/credentials");
        mockRequest.setMethod("PUT");
        mockRequest.setAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR, testRequestId);
        mockRequest.addHeader("User-Agent", "TestAgent/1.0");

        mockedRequestContextHolder = mockStatic(RequestContextHolder.class);
        mockedRequestContextHolder.when(RequestContextHolder::getRequestAttributes)
                .thenReturn(new ServletRequestAttributes(mockRequest));

        mockedSecurityContextHolder = mockStatic(SecurityContextHolder.class);
        mockedSecurityContextHolder.when(SecurityContextHolder::getContext).thenReturn(mockSecurityContext);
    }

    @AfterEach
    void tearDown() {
        mockedRequestContextHolder.close();
        mockedSecurityContextHolder.close();
    }

    private static Authentication adminAuthentication() {
        return new UsernamePasswordAuthenticationToken(TEST_PRINCIPAL, null,
                List.of(new SimpleGrantedAuthority(StaticTokenAuthFilter.ADMIN_AUTHORITY)));
    }

    @Test
    @DisplayName("logHttpEvent: Success event carries principal, request and response details")
    void logHttpEvent_success_fullContext() {
        when(mockSecurityContext.getAuthentication()).thenReturn(adminAuthentication());

        auditHelper.logHttpEvent(AuditHelper.TYPE_ADMIN, "rotate_credentials", AuditHelper.OUTCOME_SUCCESS,
                HttpStatus.NO_CONTENT.value(), "acme", null, Map.of("key", "value"));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.type()).isEqualTo(AuditHelper.TYPE_ADMIN);
        assertThat(event.action()).isEqualTo("rotate_credentials");
        assertThat(event.outcome()).isEqualTo(AuditHelper.OUTCOME_SUCCESS);
        assertThat(event.tenantId()).isEqualTo("acme");
        assertThat(event.timestamp()).isNotNull();
        assertThat(event.authInfo().principal()).isEqualTo(TEST_PRINCIPAL);
        assertThat(event.authInfo().sourceAddress()).isEqualTo(TEST_IP);
        assertThat(event.requestInfo().requestId()).isEqualTo(testRequestId);
        assertThat(event.requestInfo().httpMethod()).isEqualTo("PUT");
        assertThat(event.requestInfo().path()).isEqualTo("/v1/admin/tenants/acme/credentials");
        assertThat(event.requestInfo().headers()).isEqualTo(Map.of("User-Agent", "TestAgent/1.0"));
        assertThat(event.responseInfo().statusCode()).isEqualTo(204);
        assertThat(event.responseInfo().errorMessage()).isNull();
        assertThat(event.data()).isEqualTo(Map.of("key", "value"));
    }

    @Test
    @DisplayName("logHttpEvent: Anonymous caller is recorded as 'anonymous'")
    void logHttpEvent_anonymousUser() {
        Authentication anonymous = new UsernamePasswordAuthenticationToken("anonymousUser", null,
                List.of(new SimpleGrantedAuthority("ROLE_ANONYMOUS")));
        when(mockSecurityContext.getAuthentication()).thenReturn(anonymous);

        auditHelper.logHttpEvent(AuditHelper.TYPE_ADMIN, "get_stats", AuditHelper.OUTCOME_FAILURE,
                HttpStatus.FORBIDDEN.value(), null, "Forbidden", Map.of());

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.authInfo().principal()).isEqualTo("anonymous");
        assertThat(event.responseInfo().errorMessage()).isEqualTo("Forbidden");
        assertThat(event.data()).as("empty data is dropped").isNull();
    }

    @Test
    @DisplayName("logHttpEvent: Missing request context falls back gracefully")
    void logHttpEvent_missingRequestContext() {
        mockedRequestContextHolder.when(RequestContextHolder::getRequestAttributes).thenReturn(null);
        when(mockSecurityContext.getAuthentication()).thenReturn(adminAuthentication());

        auditHelper.logHttpEvent(AuditHelper.TYPE_DATASOURCE, "test_connection", AuditHelper.OUTCOME_SUCCESS,
                HttpStatus.OK.value(), "acme", null, null);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.authInfo().sourceAddress()).isEqualTo("unknown");
        assertThat(event.requestInfo()).isNull();
        assertThat(event.responseInfo()).isNotNull();
    }

    @Test
    @DisplayName("logInternalEvent: Uses the authenticated principal when one is present")
    void logInternalEvent_principalFromContext() {
        when(mockSecurityContext.getAuthentication()).thenReturn(adminAuthentication());

        auditHelper.logInternalEvent(AuditHelper.TYPE_DATASOURCE, "decrypt_secret", AuditHelper.OUTCOME_FAILURE,
                "acme", Map.of("error", "Invalid IV length"));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.authInfo().principal()).isEqualTo(TEST_PRINCIPAL);
        assertThat(event.tenantId()).isEqualTo("acme");
        assertThat(event.requestInfo()).isNull();
        assertThat(event.responseInfo()).isNull();
        assertThat(event.data()).isEqualTo(Map.of("error", "Invalid IV length"));
    }

    @Test
    @DisplayName("logInternalEvent: Principal defaults to 'system' without authentication")
    void logInternalEvent_defaultSystemPrincipal() {
        when(mockSecurityContext.getAuthentication()).thenReturn(null);

        auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "clear_caches", AuditHelper.OUTCOME_SUCCESS, null, null);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.authInfo().principal()).isEqualTo("system");
        assertThat(event.tenantId()).isNull();
        assertThat(event.data()).isNull();
    }

    @Test
    @DisplayName("logInternalEvent: Backend failures never reach the caller")
    void logInternalEvent_backendThrows() {
        doThrow(new RuntimeException("Logging failed!")).when(mockAuditBackend).logEvent(any(AuditEvent.class));

        assertThatCode(() -> auditHelper.logInternalEvent(AuditHelper.TYPE_ADMIN, "reset_stats",
                AuditHelper.OUTCOME_SUCCESS, null, null))
                .doesNotThrowAnyException();

        verify(mockAuditBackend).logEvent(any(AuditEvent.class));
    }
}
