package tech.yump.rotator.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit event related to an HTTP request outcome (success or failure).
     * Request context is gathered from the current servlet request if there is one.
     *
     * @param type         The type of event (e.g., "rotation_api").
     * @param action       The specific action performed (e.g., "set", "cycle").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures). Must already be redacted.
     * @param data         Optional map containing context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();

        AuditEvent.AuthInfo authInfo = buildAuthInfo(request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an audit event originating from the rotation engine itself, independent of any HTTP exchange.
     *
     * @param type      The type of event (e.g., "rotation").
     * @param action    The operation performed (e.g., "set", "rollback").
     * @param outcome   The result ("success" or "failure").
     * @param principal Optional principal identifier; defaults to "system".
     * @param data      Optional map containing context-specific data.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {

        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(Optional.ofNullable(principal).orElse("system"))
                .build();

        logEventInternal(type, action, outcome, authInfo, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
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
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            // Audit failures must never break a rotation that already happened.
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
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

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return AuditEvent.AuthInfo.builder()
                    .principal("anonymous")
                    .sourceAddress("unknown")
                    .build();
        }
        // Authentication is handled upstream; the container only tells us the remote user, if any.
        return AuditEvent.AuthInfo.builder()
                .principal(Optional.ofNullable(request.getRemoteUser()).orElse("anonymous"))
                .sourceAddress(request.getRemoteAddr())
                .build();
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId(request.getHeader(REQUEST_ID_HEADER))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
