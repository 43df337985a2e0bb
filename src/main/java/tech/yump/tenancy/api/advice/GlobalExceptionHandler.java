package tech.yump.tenancy.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.tenancy.audit.AuditHelper;
import tech.yump.tenancy.core.DataSourceManagerException;
import tech.yump.tenancy.core.TenantConfigurationException;
import tech.yump.tenancy.crypto.DecryptionException;
import tech.yump.tenancy.pool.PoolExhaustedException;
import tech.yump.tenancy.tenant.TenantNotFoundException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "5";

    private static final Pattern TENANT_PATH_PATTERN = Pattern.compile(".*/v1/admin/tenants/([^/]+)(/.*)?");

    private final AuditHelper auditHelper;

    @ExceptionHandler(TenantNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleTenantNotFound(TenantNotFoundException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Tenant Not Found");
        log.warn("Tenant not found: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(PoolExhaustedException.class)
    public ResponseEntity<ProblemDetail> handlePoolExhausted(PoolExhaustedException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Client Pool Exhausted");
        problemDetail.setProperty("liveClients", ex.getLiveClients());
        problemDetail.setProperty("maxClients", ex.getMaxClients());
        log.warn("Client pool exhausted ({}/{}). Request: {} {}",
                ex.getLiveClients(), ex.getMaxClients(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(problemDetail);
    }

    @ExceptionHandler(DecryptionException.class)
    public ResponseEntity<ProblemDetail> handleDecryption(DecryptionException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "Stored tenant credentials could not be decrypted.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Credential Decryption Failed");
        log.error("Decryption failure: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        audit(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(TenantConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleConfiguration(TenantConfigurationException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Tenant Configuration Error");
        log.error("Tenant configuration error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(DataSourceManagerException.class)
    public ResponseEntity<ProblemDetail> handleDataSourceManagerException(DataSourceManagerException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Data Source Error");
        log.error("Data source error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent("request_validation", determineAction(servletRequest), AuditHelper.OUTCOME_FAILURE,
                    status.value(), extractTenantId(servletRequest), message, null);
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging in handleHttpMessageNotReadable.");
        }

        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent("system_error", determineAction(request), AuditHelper.OUTCOME_FAILURE,
                status.value(), extractTenantId(request), message, null);
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void audit(HttpServletRequest request, HttpStatus status, String message) {
        auditHelper.logHttpEvent(
                determineEventType(request),
                determineAction(request),
                AuditHelper.OUTCOME_FAILURE,
                status.value(),
                extractTenantId(request),
                message,
                Map.of("path", request.getRequestURI()));
    }

    private String determineEventType(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/v1/admin/")) {
            return AuditHelper.TYPE_ADMIN;
        }
        return "request_error";
    }

    private String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod().toUpperCase();

        if (path.endsWith("/connection/test")) return "test_connection";
        if (path.endsWith("/connection")) return "get_connection_info";
        if (path.endsWith("/credentials")) return "rotate_credentials";
        if (path.startsWith("/v1/admin/tenants/") && path.endsWith("/cache")) return "invalidate_tenant";
        if (path.endsWith("/datasources/cache")) return "clear_caches";
        if (path.endsWith("/stats/reset")) return "reset_stats";
        if (path.endsWith("/stats") && "GET".equals(method)) return "get_stats";
        return "unknown";
    }

    private String extractTenantId(HttpServletRequest request) {
        Matcher matcher = TENANT_PATH_PATTERN.matcher(request.getRequestURI());
        return matcher.matches() ? matcher.group(1) : null;
    }
}
