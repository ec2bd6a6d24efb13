package tech.yump.rotator.api.advice;

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
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.rotation.InputValidationException;
import tech.yump.rotator.rotation.RotationErrorKind;
import tech.yump.rotator.rotation.RotationException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    private static final Pattern ROTATION_PATH_PATTERN = Pattern.compile(".*/v1/rotations/([^/]+)/([^/]+)");
    private static final Pattern TEMPLATE_PATH_PATTERN = Pattern.compile(".*/v1/templates/([^/]+)");

    static HttpStatus statusFor(RotationErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case TEMPLATE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ROTATION_IN_PROGRESS -> HttpStatus.CONFLICT;
            case RESOLUTION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXECUTOR, EXTRACTION, TEST_FAILED, ROLLBACK -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static String titleFor(RotationErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "Invalid Inputs";
            case TEMPLATE_NOT_FOUND -> "Template Not Found";
            case ROTATION_IN_PROGRESS -> "Rotation In Progress";
            case RESOLUTION -> "Template Resolution Failed";
            case EXECUTOR -> "Remote Call Failed";
            case EXTRACTION -> "Response Extraction Failed";
            case TEST_FAILED -> "Credential Verification Failed";
            case ROLLBACK -> "Rollback Failed";
        };
    }

    // --- Specific Handlers ---

    @ExceptionHandler(RotationException.class)
    public ResponseEntity<ProblemDetail> handleRotationException(RotationException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.kind());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(titleFor(ex.kind()));
        problemDetail.setProperty("kind", ex.kind().name());
        ex.phase().ifPresent(phase -> problemDetail.setProperty("phase", phase.name()));
        ex.rollbackFailure().ifPresent(rollback -> problemDetail.setProperty("rollbackError", rollback.getMessage()));
        if (ex instanceof InputValidationException validation) {
            problemDetail.setProperty("problems", validation.problems());
        }

        if (status.is5xxServerError()) {
            log.error("Rotation failed ({}): {}. Request: {} {}", ex.kind(), ex.getMessage(), request.getMethod(), request.getRequestURI());
        } else {
            log.warn("Rotation rejected ({}): {}. Request: {} {}", ex.kind(), ex.getMessage(), request.getMethod(), request.getRequestURI());
        }

        Map<String, Object> data = extractContextData(request);
        data.put("kind", ex.kind().name());
        ex.phase().ifPresent(phase -> data.put("phase", phase.name()));
        auditHelper.logHttpEvent(
                determineEventType(request),
                determineActionFromRequest(request),
                "failure",
                status.value(),
                ex.getMessage(),
                data
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditHelper.logHttpEvent(
                determineEventType(request),
                determineActionFromRequest(request),
                "failure",
                status.value(),
                ex.getMessage(),
                extractContextData(request)
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        // The parser message may echo request content, so it stays out of the response and the audit trail.
        log.warn("Bad request: Malformed JSON received. Request: {}", request.getDescription(false));

        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent(
                    "request_validation",
                    determineActionFromRequest(servletRequest),
                    "failure",
                    status.value(),
                    message,
                    extractContextData(servletRequest)
            );
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging in handleHttpMessageNotReadable.");
        }

        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred. Request: {} {}", request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent(
                "system_error",
                determineActionFromRequest(request),
                "failure",
                status.value(),
                message,
                extractContextData(request)
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    private String determineEventType(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/v1/rotations/")) {
            return "rotation_api";
        } else if (path.startsWith("/v1/templates")) {
            return "template_api";
        }
        return "request_error";
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        Matcher rotationMatcher = ROTATION_PATH_PATTERN.matcher(request.getRequestURI());
        if (rotationMatcher.matches()) {
            return rotationMatcher.group(2);
        }
        if (request.getRequestURI().startsWith("/v1/templates")) {
            return "read";
        }
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        String uri = request.getRequestURI();

        Matcher rotationMatcher = ROTATION_PATH_PATTERN.matcher(uri);
        if (rotationMatcher.matches()) {
            data.put("template", rotationMatcher.group(1));
            return data;
        }

        Matcher templateMatcher = TEMPLATE_PATH_PATTERN.matcher(uri);
        if (templateMatcher.matches()) {
            data.put("template", templateMatcher.group(1));
        }
        return data;
    }
}
