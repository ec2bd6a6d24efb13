package tech.yump.rotator.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Writes each audit event to the application log as one line: a short rotation summary
 * (type, action, outcome, template, error kind and phase) followed by the event as JSON.
 * Failed rotations are logged at WARN, everything else at INFO.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    static final String MARKER = "ROTATION_AUDIT";

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("{} dropped a null event", MARKER);
            return;
        }

        String summary = summarize(event);
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            // Only the summary fields are safe to print without the serializer.
            log.error("{} [{}] could not be serialized: {}", MARKER, summary, e.getOriginalMessage());
            return;
        }
        if ("failure".equals(event.outcome())) {
            log.warn("{} [{}] {}", MARKER, summary, json);
        } else {
            log.info("{} [{}] {}", MARKER, summary, json);
        }
    }

    static String summarize(AuditEvent event) {
        StringBuilder summary = new StringBuilder()
                .append("type=").append(event.type())
                .append(" action=").append(event.action())
                .append(" outcome=").append(event.outcome());
        Map<String, Object> data = event.data();
        if (data != null) {
            appendIfPresent(summary, "template", data.get("template"));
            appendIfPresent(summary, "kind", data.get("kind"));
            appendIfPresent(summary, "phase", data.get("phase"));
            appendIfPresent(summary, "rollback", data.get("rollback"));
        }
        if (event.responseInfo() != null) {
            summary.append(" status=").append(event.responseInfo().statusCode());
        }
        return summary.toString();
    }

    private static void appendIfPresent(StringBuilder summary, String key, Object value) {
        if (value != null) {
            summary.append(' ').append(key).append('=').append(value);
        }
    }
}
