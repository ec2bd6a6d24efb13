package tech.yump.rotator.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry, serialized as JSON by the backends.
 * {@code data} only ever carries declared, non-sensitive rotation fields.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "rotation", "rotation_api"
        String action,          // e.g. "set", "remove", "test", "cycle"
        String outcome,         // "success" or "failure"

        AuthInfo authInfo,

        RequestInfo requestInfo,

        ResponseInfo responseInfo,

        Map<String, Object> data
) {

    /**
     * Who triggered the event, as far as it is known.
     */
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
            Map<String, String> headers // non-sensitive headers only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
