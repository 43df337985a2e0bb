package tech.yump.tenancy.audit;

/**
 * Destination for audit events.
 */
public interface AuditBackend {

    /**
     * @param event the event to record. Must not be null.
     */
    void logEvent(AuditEvent event);

}
