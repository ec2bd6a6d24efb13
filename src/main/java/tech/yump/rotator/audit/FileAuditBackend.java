package tech.yump.rotator.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An AuditBackend implementation that writes audit events as JSON lines
 * to a dedicated logger, routed to its own file by logback-spring.xml.
 */
@RequiredArgsConstructor
@Slf4j
public class FileAuditBackend implements AuditBackend {

    // Must match the logger name in logback-spring.xml
    public static final String AUDIT_LOGGER_NAME = "tech.yump.rotator.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            auditLogger.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            // Serialization problems go to the application log, never into the audit file.
            log.error("Failed to serialize AuditEvent to JSON for file audit logging. Type={}, Action={}",
                    event.type(), event.action(), e);
        }
    }
}
