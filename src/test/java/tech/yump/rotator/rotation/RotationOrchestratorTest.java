package tech.yump.rotator.rotation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.crypto.SecureRandomGenerator;
import tech.yump.rotator.executor.ExecutorException;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.executor.OperationDispatcher;
import tech.yump.rotator.expression.ExpressionEngine;
import tech.yump.rotator.expression.ResolutionException;
import tech.yump.rotator.extract.ExtractionException;
import tech.yump.rotator.extract.ResponseExtractor;
import tech.yump.rotator.template.Namespace;
import tech.yump.rotator.template.Operation;
import tech.yump.rotator.template.OperationName;
import tech.yump.rotator.template.ProviderTemplate;
import tech.yump.rotator.template.TemplateFixtures;
import tech.yump.rotator.template.TemplateRegistry;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RotationOrchestratorTest {

    private static final String ADMIN_TOKEN = "admin-token-4f9a1c";

    private static final ProviderTemplate WEBHOOK = TemplateFixtures.parse("""
            {"name": "webhook",
             "inputs": {
               "token": {"type": "string", "required": true, "sensitive": true},
               "account": {"type": "string", "required": true}},
             "outputs": {"key": {"type": "string", "sensitive": true}},
             "internal": {"key_id": {"type": "string"}},
             "identity": ["account"],
             "functions": {
               "set": {"type": "HTTP", "method": "POST", "url": "https://hooks.example.com/keys",
                 "header": {"Authorization": "Bearer ${inputs.token}"},
                 "setter": {"internal.key_id": {"path": "id"}, "outputs.key": {"path": "key"}}},
               "test": {"type": "HTTP", "method": "GET", "url": "https://hooks.example.com/keys/${internal.key_id}"},
               "remove": {"type": "HTTP", "method": "DELETE", "url": "https://hooks.example.com/keys/${internal.key_id}"}}}
            """);

    private static final Operation SET = WEBHOOK.operation(OperationName.SET).orElseThrow();
    private static final Operation TEST = WEBHOOK.operation(OperationName.TEST).orElseThrow();
    private static final Operation REMOVE = WEBHOOK.operation(OperationName.REMOVE).orElseThrow();

    @Mock
    private TemplateRegistry templateRegistry;

    @Mock
    private OperationDispatcher dispatcher;

    @Mock
    private AuditHelper auditHelper;

    @Captor
    private ArgumentCaptor<RotationContext> contextCaptor;

    @Captor
    private ArgumentCaptor<Map<String, Object>> auditDataCaptor;

    private final ObjectMapper objectMapper = TemplateFixtures.MAPPER;
    private final RotationLockRegistry lockRegistry = new RotationLockRegistry();
    private RotationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = orchestrator(RetryPolicy.none());
    }

    private RotationOrchestrator orchestrator(RetryPolicy retryPolicy) {
        SecureRandomGenerator randomGenerator = new SecureRandomGenerator();
        return new RotationOrchestrator(templateRegistry, new InputValidator(objectMapper),
                new ExpressionEngine(randomGenerator), randomGenerator, dispatcher, new ResponseExtractor(objectMapper),
                lockRegistry, retryPolicy, auditHelper, objectMapper);
    }

    private static Map<String, Object> inputs() {
        return Map.of("token", ADMIN_TOKEN, "account", "acme");
    }

    private ExecutorResult body(String json) throws Exception {
        return ExecutorResult.ofBody(objectMapper.readTree(json));
    }

    @Test
    @DisplayName("rotate(set): Should commit outputs and internal state after a passing test")
    void rotate_Success() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenReturn(body("{\"id\": \"k-1\", \"key\": \"whk_new\"}"));
        when(dispatcher.dispatch(same(TEST), contextCaptor.capture(), any())).thenReturn(body("{}"));

        // Act
        RotationResult result = orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of("key_id", "k-0"));

        // Assert
        assertThat(result.outputs()).containsExactly(Map.entry("key", "whk_new"));
        assertThat(result.internal()).containsExactly(Map.entry("key_id", "k-1"));
        assertThat(contextCaptor.getValue().lookup(Namespace.INTERNAL, "key_id").orElseThrow().asText()).isEqualTo("k-1");
        verify(dispatcher, never()).dispatch(same(REMOVE), any(), any());
        verify(auditHelper).logInternalEvent(eq("rotation"), eq("set"), eq("success"), isNull(), auditDataCaptor.capture());
        assertThat(auditDataCaptor.getValue())
                .containsEntry("template", "webhook")
                .containsEntry("identity", Map.of("account", "acme"));
        assertThat(lockRegistry.isLocked(WEBHOOK, objectMapper.valueToTree(inputs()))).isFalse();
    }

    @Test
    @DisplayName("rotate(set): Extraction failure should roll back with partial values and commit nothing")
    void rotate_ExtractionFailure_RollsBack() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenReturn(body("{\"id\": \"k-1\"}"));
        when(dispatcher.dispatch(same(REMOVE), contextCaptor.capture(), any())).thenReturn(body("{}"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of()))
                .isInstanceOfSatisfying(ExtractionException.class, e -> {
                    assertThat(e.kind()).isEqualTo(RotationErrorKind.EXTRACTION);
                    assertThat(e.phase()).hasValue(RotationPhase.EXTRACTING);
                    assertThat(e.rollbackFailure()).isEmpty();
                });

        assertThat(contextCaptor.getValue().lookup(Namespace.INTERNAL, "key_id").orElseThrow().asText()).isEqualTo("k-1");
        verify(dispatcher, never()).dispatch(same(TEST), any(), any());
        verify(auditHelper).logInternalEvent(eq("rotation"), eq("rollback"), eq("success"), isNull(), any());
        verify(auditHelper).logInternalEvent(eq("rotation"), eq("set"), eq("failure"), isNull(), auditDataCaptor.capture());
        assertThat(auditDataCaptor.getValue())
                .containsEntry("kind", "EXTRACTION")
                .containsEntry("phase", "EXTRACTING")
                .containsEntry("rollback", "success");
    }

    @Test
    @DisplayName("rotate(set): A failing rollback should be attached to the original error")
    void rotate_RollbackFailureAttached() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenReturn(body("{\"id\": \"k-1\"}"));
        when(dispatcher.dispatch(same(REMOVE), any(), any()))
                .thenThrow(new ExecutorException("DELETE returned 500", 500, true));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of()))
                .isInstanceOfSatisfying(ExtractionException.class, e -> {
                    assertThat(e.rollbackFailure()).hasValueSatisfying(rollback -> {
                        assertThat(rollback.kind()).isEqualTo(RotationErrorKind.ROLLBACK);
                        assertThat(rollback.phase()).hasValue(RotationPhase.ROLLING_BACK);
                        assertThat(rollback.getMessage()).contains("DELETE returned 500");
                    });
                    assertThat(e.getSuppressed()).hasSize(1);
                });
        // The rollback is a single attempt, whatever the retry policy.
        verify(dispatcher, times(1)).dispatch(same(REMOVE), any(), any());
    }

    @Test
    @DisplayName("rotate(set): A failing test should surface as TEST_FAILED and roll back")
    void rotate_TestFailure() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenReturn(body("{\"id\": \"k-1\", \"key\": \"whk_new\"}"));
        when(dispatcher.dispatch(same(TEST), any(), any())).thenThrow(new ExecutorException("GET returned 401", 401, false));
        when(dispatcher.dispatch(same(REMOVE), contextCaptor.capture(), any())).thenReturn(body("{}"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of()))
                .isInstanceOfSatisfying(TestFailedException.class, e -> {
                    assertThat(e.kind()).isEqualTo(RotationErrorKind.TEST_FAILED);
                    assertThat(e.phase()).hasValue(RotationPhase.TESTING);
                    assertThat(e.getCause()).isInstanceOf(ExecutorException.class);
                });
        assertThat(contextCaptor.getValue().lookup(Namespace.OUTPUTS, "key").orElseThrow().asText()).isEqualTo("whk_new");
    }

    @Test
    @DisplayName("rotate(set): Executor failure should still attempt remove, without the prior cycle's state")
    void rotate_ExecutorFailure_RollsBackWithoutPriorState() {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenThrow(new ExecutorException("POST returned 504", 504, false));
        when(dispatcher.dispatch(same(REMOVE), contextCaptor.capture(), any()))
                .thenThrow(new ResolutionException("Unknown reference 'internal.key_id'"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of("key_id", "k-0")))
                .isInstanceOfSatisfying(ExecutorException.class, e -> {
                    assertThat(e.phase()).hasValue(RotationPhase.EXECUTING);
                    assertThat(e.status()).hasValue(504);
                    assertThat(e.rollbackFailure()).hasValueSatisfying(rollback ->
                            assertThat(rollback.getCause()).isInstanceOf(ResolutionException.class));
                });
        // k-0 is the live key of the previous cycle and must not be targeted.
        assertThat(contextCaptor.getValue().lookup(Namespace.INTERNAL, "key_id")).isEmpty();
        assertThat(contextCaptor.getValue().lookup(Namespace.INPUTS, "account").orElseThrow().asText()).isEqualTo("acme");
        verify(dispatcher, never()).dispatch(same(TEST), any(), any());
        verify(auditHelper).logInternalEvent(eq("rotation"), eq("rollback"), eq("failure"), isNull(), any());
    }

    @Test
    @DisplayName("rotate(set): Extraction failure should not hand a seeded id to the rollback")
    void rotate_ExtractionFailure_IgnoresSeededId() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenReturn(body("{\"key\": \"whk_new\"}"));
        when(dispatcher.dispatch(same(REMOVE), contextCaptor.capture(), any())).thenReturn(body("{}"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of("key_id", "k-0")))
                .isInstanceOf(ExtractionException.class);
        assertThat(contextCaptor.getValue().lookup(Namespace.INTERNAL, "key_id")).isEmpty();
    }

    @Test
    @DisplayName("rotate(set): A resolution failure sends nothing and should not roll back")
    void rotate_ResolutionFailure_NoRollback() {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenThrow(new ResolutionException("Unknown reference 'inputs.region'"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of()))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.phase()).hasValue(RotationPhase.EXECUTING));
        verify(dispatcher, never()).dispatch(same(REMOVE), any(), any());
    }

    @Test
    @DisplayName("rotate(set): Retryable executor failures should be retried by the policy")
    void rotate_RetriesExecutor() throws Exception {
        // Arrange
        RotationOrchestrator retrying = orchestrator(new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0));
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any()))
                .thenThrow(new ExecutorException("POST returned 503", 503, true))
                .thenThrow(new ExecutorException("POST timed out", true))
                .thenReturn(body("{\"id\": \"k-1\", \"key\": \"whk_new\"}"));
        when(dispatcher.dispatch(same(TEST), any(), any())).thenReturn(body("{}"));

        // Act
        RotationResult result = retrying.rotate("webhook", OperationName.SET, inputs(), Map.of());

        // Assert
        assertThat(result.outputs()).containsEntry("key", "whk_new");
        verify(dispatcher, times(3)).dispatch(same(SET), any(), any());
    }

    @Test
    @DisplayName("rotate(set): A cancelled cycle should fail without rollback")
    void rotate_Cancelled_NoRollback() throws Exception {
        // Arrange
        CancellationSignal signal = CancellationSignal.create();
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any())).thenReturn(body("{\"id\": \"k-1\", \"key\": \"whk_new\"}"));
        when(dispatcher.dispatch(same(TEST), any(), same(signal))).thenAnswer(invocation -> {
            signal.cancel();
            throw ExecutorException.cancelled("GET https://hooks.example.com");
        });

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of(), signal))
                .isInstanceOf(TestFailedException.class);
        verify(dispatcher, never()).dispatch(same(REMOVE), any(), any());
    }

    @Test
    @DisplayName("rotate: A second cycle for the same credential should be rejected")
    void rotate_LockHeld() {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        ObjectNode identity = objectMapper.createObjectNode().put("account", "acme");

        // Act & Assert
        try (RotationLockRegistry.Lock ignored = lockRegistry.acquire(WEBHOOK, identity)) {
            assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of()))
                    .isInstanceOfSatisfying(RotationInProgressException.class,
                            e -> assertThat(e.phase()).hasValue(RotationPhase.PREPARING));
        }
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("rotate: Invalid inputs should fail in PREPARING without any remote call")
    void rotate_InvalidInputs() {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, Map.of("token", ADMIN_TOKEN), Map.of()))
                .isInstanceOfSatisfying(InputValidationException.class, e -> {
                    assertThat(e.problems()).containsExactly("'account' is required");
                    assertThat(e.phase()).hasValue(RotationPhase.PREPARING);
                });
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("rotate: Unexpected failures should be wrapped with secrets redacted from message and audit")
    void rotate_UnexpectedFailure_Redacted() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(SET), any(), any()))
                .thenThrow(new IllegalStateException("header Bearer " + ADMIN_TOKEN + " rejected"));
        when(dispatcher.dispatch(same(REMOVE), any(), any())).thenReturn(body("{}"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.rotate("webhook", OperationName.SET, inputs(), Map.of()))
                .isInstanceOfSatisfying(ExecutorException.class, e -> {
                    assertThat(e.getMessage()).doesNotContain(ADMIN_TOKEN).contains("Bearer ****");
                    assertThat(e.isRetryable()).isFalse();
                });
        verify(auditHelper).logInternalEvent(eq("rotation"), eq("set"), eq("failure"), isNull(), auditDataCaptor.capture());
        assertThat(auditDataCaptor.getValue().toString()).doesNotContain(ADMIN_TOKEN);
    }

    @Test
    @DisplayName("rotate(remove): Should run directly and never trigger a test or rollback")
    void rotate_Remove() throws Exception {
        // Arrange
        when(templateRegistry.get("webhook")).thenReturn(WEBHOOK);
        when(dispatcher.dispatch(same(REMOVE), contextCaptor.capture(), any())).thenReturn(body("{}"));

        // Act
        RotationResult result = orchestrator.rotate("webhook", OperationName.REMOVE, inputs(), Map.of("key_id", "k-0"));

        // Assert
        assertThat(result.outputs()).isEmpty();
        assertThat(result.internal()).containsEntry("key_id", "k-0");
        assertThat(contextCaptor.getValue().lookup(Namespace.INTERNAL, "key_id").orElseThrow().asText()).isEqualTo("k-0");
        verify(dispatcher, never()).dispatch(same(TEST), any(), any());
    }
}
