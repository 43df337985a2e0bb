package tech.yump.tenancy.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * One audit log entry, serialized as JSON by the configured {@link AuditBackend}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "datasource", "auth", "admin"
        String action,          // e.g. "rotate_credentials", "decrypt_secret"
        String outcome,         // "success", "failure" or "denied"
        String tenantId,        // control-plane id of the affected tenant, if any
        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
