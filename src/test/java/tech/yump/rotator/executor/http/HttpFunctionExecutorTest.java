package tech.yump.rotator.executor.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tech.yump.rotator.crypto.SecureRandomGenerator;
import tech.yump.rotator.executor.ExecutorException;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.expression.ExpressionEngine;
import tech.yump.rotator.expression.ResolutionException;
import tech.yump.rotator.rotation.CancellationSignal;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.HttpOperation;

import java.net.ConnectException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpFunctionExecutorTest {

    private static final String ADMIN_KEY = "SG.admin-key-7d1e";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private HttpFunctionExecutor executor;
    private RotationContext context;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        executor = new HttpFunctionExecutor(builder.build(), new ExpressionEngine(new SecureRandomGenerator()), objectMapper);

        ObjectNode inputs = objectMapper.createObjectNode();
        inputs.put("admin_api_key", ADMIN_KEY);
        inputs.putArray("scopes").add("mail.send");
        ObjectNode internal = objectMapper.createObjectNode();
        internal.put("api_key_id", "key 42");
        context = RotationContext.of(inputs, internal);
        context.registerSecret(ADMIN_KEY);
    }

    private HttpOperation operation(String method, String url, String body) throws Exception {
        return new HttpOperation(method, url,
                Map.of("Authorization", "Bearer ${inputs.admin_api_key}"),
                body == null ? null : objectMapper.readTree(body),
                Map.of(), Map.of());
    }

    @Test
    @DisplayName("execute: Should send resolved headers and JSON body and parse the response")
    void execute_Success() throws Exception {
        // Arrange
        server.expect(requestTo("https://api.example.com/v3/api_keys"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer " + ADMIN_KEY))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.scopes[0]").value("mail.send"))
                .andExpect(jsonPath("$.name").value("lite-rotator"))
                .andRespond(withStatus(HttpStatus.CREATED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "r-1")
                        .body("{\"api_key\": \"SG.new\", \"api_key_id\": \"43\"}"));

        // Act
        ExecutorResult result = executor.execute(
                operation("post", "https://api.example.com/v3/api_keys",
                        "{\"name\": \"lite-rotator\", \"scopes\": {\"ref\": \"inputs.scopes\"}}"),
                context, CancellationSignal.create());

        // Assert
        server.verify();
        assertThat(result.status()).isEqualTo(201);
        assertThat(result.body().get("api_key_id").asText()).isEqualTo("43");
        assertThat(result.headersDocument().get("x-request-id").asText()).isEqualTo("r-1");
        assertThat(result.toString()).doesNotContain("SG.new");
    }

    @Test
    @DisplayName("execute: Should percent-encode resolved path values")
    void execute_EncodesPathValues() throws Exception {
        server.expect(requestTo("https://api.example.com/v3/api_keys/key%2042"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        ExecutorResult result = executor.execute(
                operation("DELETE", "https://api.example.com/v3/api_keys/${internal.api_key_id}", null),
                context, CancellationSignal.create());

        server.verify();
        assertThat(result.status()).isEqualTo(204);
        assertThat(result.body().isObject()).isTrue();
        assertThat(result.body().size()).isZero();
    }

    @Test
    @DisplayName("execute: Non-2xx should fail with a redacted, truncated diagnostic")
    void execute_ErrorStatus() throws Exception {
        server.expect(requestTo("https://api.example.com/v3/api_keys"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .body("{\"error\": \"key " + ADMIN_KEY + " lacks scope\"}" + "x".repeat(400)));

        assertThatThrownBy(() -> executor.execute(operation("POST", "https://api.example.com/v3/api_keys", "{}"),
                context, CancellationSignal.create()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> {
                    assertThat(e.status()).hasValue(403);
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(e.getMessage())
                            .startsWith("POST api.example.com returned status 403")
                            .contains("key **** lacks scope")
                            .doesNotContain(ADMIN_KEY)
                            .endsWith("...");
                });
    }

    @Test
    @DisplayName("execute: 429 and 503 responses should be retryable")
    void execute_RetryableStatuses() throws Exception {
        server.expect(requestTo("https://api.example.com/v3/api_keys")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo("https://api.example.com/v3/api_keys")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        HttpOperation get = operation("GET", "https://api.example.com/v3/api_keys", null);

        assertThatThrownBy(() -> executor.execute(get, context, CancellationSignal.create()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> assertThat(e.isRetryable()).isTrue());
        assertThatThrownBy(() -> executor.execute(get, context, CancellationSignal.create()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    @DisplayName("execute: Gateway errors should only be retryable for idempotent methods")
    void execute_GatewayErrors() throws Exception {
        server.expect(requestTo("https://api.example.com/v3/api_keys")).andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT));
        server.expect(requestTo("https://api.example.com/v3/api_keys")).andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT));

        assertThatThrownBy(() -> executor.execute(operation("POST", "https://api.example.com/v3/api_keys", "{}"),
                context, CancellationSignal.create()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> {
                    assertThat(e.status()).hasValue(504);
                    assertThat(e.isRetryable()).isFalse();
                });
        assertThatThrownBy(() -> executor.execute(operation("GET", "https://api.example.com/v3/api_keys", null),
                context, CancellationSignal.create()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> assertThat(e.isRetryable()).isTrue());

        assertThat(HttpFunctionExecutor.isRetryable(HttpMethod.POST, 429)).isTrue();
        assertThat(HttpFunctionExecutor.isRetryable(HttpMethod.POST, 503)).isTrue();
        assertThat(HttpFunctionExecutor.isRetryable(HttpMethod.POST, 502)).isFalse();
        assertThat(HttpFunctionExecutor.isRetryable(HttpMethod.DELETE, 502)).isTrue();
        assertThat(HttpFunctionExecutor.isRetryable(HttpMethod.DELETE, 500)).isFalse();
    }

    @Test
    @DisplayName("execute: A non-JSON body should be kept as text")
    void execute_TextBody() throws Exception {
        server.expect(requestTo("https://api.example.com/health"))
                .andRespond(withSuccess("OK", MediaType.TEXT_PLAIN));

        ExecutorResult result = executor.execute(operation("GET", "https://api.example.com/health", null),
                context, CancellationSignal.create());

        assertThat(result.body().isTextual()).isTrue();
        assertThat(result.body().asText()).isEqualTo("OK");
    }

    @Test
    @DisplayName("execute: Connection failures should be retryable executor errors")
    void execute_ConnectFailure() throws Exception {
        server.expect(requestTo("https://api.example.com/v3/api_keys"))
                .andRespond(withException(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> executor.execute(operation("GET", "https://api.example.com/v3/api_keys", null),
                context, CancellationSignal.create()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.status()).isEmpty();
                });
    }

    @Test
    @DisplayName("execute: A cancelled signal should stop the call before it is sent")
    void execute_Cancelled() throws Exception {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        assertThatThrownBy(() -> executor.execute(operation("GET", "https://api.example.com/v3/api_keys", null), context, signal))
                .isInstanceOfSatisfying(ExecutorException.class, e -> assertThat(e.isCancelled()).isTrue());
        server.verify();
    }

    @Test
    @DisplayName("execute: A url that does not resolve to an absolute http(s) URL should be a resolution error")
    void execute_InvalidUrl() {
        assertThatThrownBy(() -> executor.execute(operation("GET", "ftp://files.example.com/keys", null),
                context, CancellationSignal.create()))
                .isInstanceOf(ResolutionException.class);
    }

    @Test
    @DisplayName("encodeUrlValue: Should leave the authority alone and encode path and query values")
    void encodeUrlValue() {
        assertThat(HttpFunctionExecutor.encodeUrlValue("api.example.com", "https://")).isEqualTo("api.example.com");
        assertThat(HttpFunctionExecutor.encodeUrlValue("a/b c", "https://api.example.com/keys/")).isEqualTo("a%2Fb%20c");
        assertThat(HttpFunctionExecutor.encodeUrlValue("a&b=c", "https://api.example.com/keys?name=")).isEqualTo("a%26b%3Dc");
    }
}
