package tech.yump.tenancy.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events as single-line JSON to the SLF4J logger at INFO level.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            log.info("AUDIT_EVENT: {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize AuditEvent to JSON. Logging raw event details.", e);
            log.info("AUDIT_EVENT_FALLBACK: {}", event);
        }
    }
}
