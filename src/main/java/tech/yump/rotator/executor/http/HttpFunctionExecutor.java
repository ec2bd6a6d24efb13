package tech.yump.rotator.executor.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriUtils;
import tech.yump.rotator.executor.ExecutorException;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.executor.FunctionExecutor;
import tech.yump.rotator.expression.ExpressionEngine;
import tech.yump.rotator.expression.ResolutionException;
import tech.yump.rotator.rotation.CancellationSignal;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.HttpOperation;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Issues one HTTP request through the shared {@link RestClient}.
 * Any non-2xx status is a failure; the executor never retries on its own.
 * <p>
 * Values substituted into the path or query of the url are percent-encoded for their position;
 * values before the path (scheme, host, port) are substituted as they are.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpFunctionExecutor implements FunctionExecutor<HttpOperation> {

    static final int MAX_DIAGNOSTIC_LENGTH = 256;
    // Refused before the request was processed; safe to repeat for any method.
    private static final Set<Integer> REFUSED_STATUSES = Set.of(429, 503);
    // The upstream may have acted on the request.
    private static final Set<Integer> GATEWAY_STATUSES = Set.of(502, 504);
    private static final Set<HttpMethod> IDEMPOTENT_METHODS = Set.of(
            HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.PUT, HttpMethod.DELETE);

    private final RestClient rotatorRestClient;
    private final ExpressionEngine expressionEngine;
    private final ObjectMapper objectMapper;

    @Override
    public ExecutorResult execute(HttpOperation operation, RotationContext context, CancellationSignal signal) {
        HttpMethod method = HttpMethod.valueOf(expressionEngine.resolve(operation.method(), context).trim().toUpperCase(Locale.ROOT));
        URI uri = resolveUri(operation, context);
        HttpHeaders headers = new HttpHeaders();
        for (Map.Entry<String, String> header : operation.header().entrySet()) {
            headers.add(header.getKey(), expressionEngine.resolve(header.getValue(), context));
        }
        JsonNode body = operation.hasBody() ? expressionEngine.resolve(operation.body(), context) : null;

        String target = method + " " + uri.getHost();
        if (signal.isCancelled()) {
            throw ExecutorException.cancelled(target);
        }

        log.debug("Sending {} {}", method, uri.getHost() + uri.getPath());
        Thread caller = Thread.currentThread();
        RawResponse response;
        try (CancellationSignal.Registration ignored = signal.onCancel(caller::interrupt)) {
            RestClient.RequestBodySpec request = rotatorRestClient.method(method)
                    .uri(uri)
                    .headers(h -> h.addAll(headers));
            if (body != null) {
                request.contentType(MediaType.APPLICATION_JSON).body(writeBody(body));
            }
            response = request.exchange((req, res) -> new RawResponse(
                    res.getStatusCode().value(),
                    res.getHeaders(),
                    StreamUtils.copyToByteArray(res.getBody())));
        } catch (RestClientException e) {
            if (signal.isCancelled()) {
                clearInterrupt();
                log.info("{} was cancelled", target);
                throw ExecutorException.cancelled(target);
            }
            throw transportFailure(target, e, context);
        } finally {
            if (signal.isCancelled()) {
                clearInterrupt();
            }
        }

        if (signal.isCancelled()) {
            throw ExecutorException.cancelled(target);
        }
        if (response.status() < 200 || response.status() > 299) {
            String diagnostic = context.redact(truncate(new String(response.body(), StandardCharsets.UTF_8)));
            log.warn("{} returned status {}", target, response.status());
            throw new ExecutorException(target + " returned status " + response.status() + ": " + diagnostic,
                    response.status(), isRetryable(method, response.status()));
        }
        log.info("{} completed with status {}", target, response.status());
        return new ExecutorResult(response.status(), response.headers(), parseBody(response.body()));
    }

    static boolean isRetryable(HttpMethod method, int status) {
        return REFUSED_STATUSES.contains(status)
                || (GATEWAY_STATUSES.contains(status) && IDEMPOTENT_METHODS.contains(method));
    }

    private URI resolveUri(HttpOperation operation, RotationContext context) {
        String url = expressionEngine.resolve(operation.url(), context, HttpFunctionExecutor::encodeUrlValue);
        try {
            URI uri = URI.create(url);
            if (uri.getHost() == null || !("https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme()))) {
                throw new ResolutionException("HTTP url does not resolve to an absolute http(s) URL");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ResolutionException("HTTP url does not resolve to a valid URI", e);
        }
    }

    static String encodeUrlValue(String value, String precedingTemplate) {
        int scheme = precedingTemplate.indexOf("://");
        int pathStart = scheme < 0 ? -1 : precedingTemplate.indexOf('/', scheme + 3);
        if (pathStart < 0) {
            return value;
        }
        return precedingTemplate.indexOf('?', pathStart) < 0
                ? UriUtils.encodePathSegment(value, StandardCharsets.UTF_8)
                : UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
    }

    private String writeBody(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Could not serialize request body", e, false);
        }
    }

    private JsonNode parseBody(byte[] bytes) {
        if (bytes.length == 0) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            log.debug("Response body is not JSON, keeping it as text");
            return TextNode.valueOf(new String(bytes, StandardCharsets.UTF_8));
        }
    }

    private ExecutorException transportFailure(String target, RestClientException e, RotationContext context) {
        boolean connectFailure = e instanceof ResourceAccessException && isConnectFailure(e);
        String reason = context.redact(e.getMessage());
        log.warn("{} failed before a response was received: {}", target, reason);
        return new ExecutorException(target + " failed: " + reason, e, connectFailure);
    }

    private static boolean isConnectFailure(Throwable throwable) {
        for (Throwable cause = throwable; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException
                    || cause instanceof HttpConnectTimeoutException
                    || cause instanceof UnknownHostException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static void clearInterrupt() {
        // The interrupt was ours; do not leak it to the caller's thread.
        Thread.interrupted();
    }

    private static String truncate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= MAX_DIAGNOSTIC_LENGTH ? trimmed : trimmed.substring(0, MAX_DIAGNOSTIC_LENGTH) + "...";
    }

    private record RawResponse(int status, HttpHeaders headers, byte[] body) {
    }
}
