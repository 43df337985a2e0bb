package tech.yump.tenancy.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.tenancy.auth.StaticTokenAuthFilter;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String TYPE_DATASOURCE = "datasource";
    public static final String TYPE_ADMIN = "admin";
    public static final String TYPE_AUTH = "auth";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final AuditBackend auditBackend;

    /**
     * Logs the outcome of an HTTP request, gathering request and principal details from the
     * current request context when there is one.
     *
     * @param tenantId     control-plane id of the affected tenant, may be null
     * @param errorMessage error message for failures, may be null
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String tenantId,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        AuditEvent.AuthInfo authInfo = buildAuthInfo(authentication, request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, tenantId, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an event raised inside the data source manager itself. The principal falls back to
     * {@code "system"} when no authenticated caller is on the current thread.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String tenantId,
            @Nullable Map<String, Object> data) {

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        String principal = (authentication != null && authentication.isAuthenticated())
                ? authentication.getName()
                : "system";
        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(principal)
                .build();

        logEventInternal(type, action, outcome, tenantId, authInfo, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable String tenantId,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .tenantId(tenantId)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable Authentication authentication, @Nullable HttpServletRequest request) {
        AuditEvent.AuthInfo.AuthInfoBuilder builder = AuditEvent.AuthInfo.builder()
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown");

        if (authentication != null && authentication.isAuthenticated() && !"anonymousUser".equals(authentication.getPrincipal())) {
            builder.principal(authentication.getName());
        } else {
            builder.principal("anonymous");
        }
        return builder.build();
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
