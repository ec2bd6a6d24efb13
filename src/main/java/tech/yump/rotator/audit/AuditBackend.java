package tech.yump.rotator.audit;

/**
 * Destination of rotation audit events.
 * <p>
 * Receives one event per engine outcome (type {@code rotation}: set, test, remove and rollback)
 * and one per API request outcome (type {@code rotation_api}). Events never carry secret values
 * or {@code internal} state, so a backend may write them anywhere.
 */
public interface AuditBackend {

    /**
     * Records one event. Implementations must not throw for a malformed event;
     * {@link AuditHelper} still guards against it so a rotation is never failed by its audit.
     *
     * @param event the event to record.
     */
    void logEvent(AuditEvent event);
}
