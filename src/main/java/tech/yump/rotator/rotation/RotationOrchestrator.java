package tech.yump.rotator.rotation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.crypto.SecureRandomGenerator;
import tech.yump.rotator.executor.ExecutorException;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.executor.OperationDispatcher;
import tech.yump.rotator.expression.ExpressionEngine;
import tech.yump.rotator.expression.ResolutionException;
import tech.yump.rotator.extract.ExtractionException;
import tech.yump.rotator.extract.ResponseExtractor;
import tech.yump.rotator.extract.SetterResult;
import tech.yump.rotator.template.Assignment;
import tech.yump.rotator.template.FieldRef;
import tech.yump.rotator.template.FieldSchema;
import tech.yump.rotator.template.Namespace;
import tech.yump.rotator.template.Operation;
import tech.yump.rotator.template.OperationName;
import tech.yump.rotator.template.ProviderTemplate;
import tech.yump.rotator.template.TemplateRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one operation of a provider template as a rotation cycle:
 * {@code IDLE -> PREPARING -> EXECUTING -> EXTRACTING [-> TESTING] -> COMMITTED}.
 * <p>
 * The cycle works on its own copy of inputs and internal state; nothing is returned unless the
 * cycle commits. When a {@code set} fails after reaching the remote system (during extraction or
 * verification) and the template has a {@code remove}, one best-effort removal runs against the
 * staged state before the original error is rethrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RotationOrchestrator {

    static final String AUDIT_TYPE = "rotation";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final TemplateRegistry templateRegistry;
    private final InputValidator inputValidator;
    private final ExpressionEngine expressionEngine;
    private final SecureRandomGenerator randomGenerator;
    private final OperationDispatcher dispatcher;
    private final ResponseExtractor extractor;
    private final RotationLockRegistry lockRegistry;
    private final RetryPolicy retryPolicy;
    private final AuditHelper auditHelper;
    private final ObjectMapper objectMapper;

    public RotationResult rotate(String templateName, OperationName operationName,
                                 Map<String, Object> inputs, Map<String, Object> priorInternal) {
        return rotate(templateName, operationName, inputs, priorInternal, CancellationSignal.create());
    }

    /**
     * Runs one cycle of the named operation.
     *
     * @param priorInternal internal state returned by the previous successful cycle, may be empty.
     * @param signal        cancels the in-flight remote call; the cycle then fails without rollback.
     * @return the committed outputs and internal state.
     * @throws RotationException with its kind and phase; nothing of the failed cycle is committed.
     */
    public RotationResult rotate(String templateName, OperationName operationName,
                                 Map<String, Object> inputs, Map<String, Object> priorInternal,
                                 CancellationSignal signal) {
        ProviderTemplate template = templateRegistry.get(templateName);
        RotationCycle cycle = new RotationCycle(templateName, operationName);
        cycle.transition(RotationPhase.PREPARING);

        ObjectNode validatedInputs;
        ObjectNode seededInternal;
        Operation operation;
        try {
            operation = template.operation(operationName)
                    .orElseThrow(() -> new InputValidationException(templateName,
                            List.of("operation '" + operationName.value() + "' is not defined by this template")));
            validatedInputs = inputValidator.validateInputs(template, inputs);
            seededInternal = inputValidator.seedInternal(template, priorInternal);
        } catch (RotationException e) {
            fail(cycle, e);
            audit(template, operationName, "failure", identityOf(template, null), e, null, e.getMessage());
            throw e;
        }

        RotationContext context = RotationContext.of(validatedInputs, seededInternal);
        registerSensitive(template, context);
        Map<String, Object> identity = identityOf(template, validatedInputs);

        RotationLockRegistry.Lock lock;
        try {
            lock = lockRegistry.acquire(template, validatedInputs);
        } catch (RotationInProgressException e) {
            fail(cycle, e);
            audit(template, operationName, "failure", identity, e, null, e.getMessage());
            throw e;
        }
        try (lock) {
            return runCycle(template, operationName, operation, context, cycle, identity, signal);
        }
    }

    private RotationResult runCycle(ProviderTemplate template, OperationName operationName, Operation operation,
                                    RotationContext staged, RotationCycle cycle, Map<String, Object> identity,
                                    CancellationSignal signal) {
        log.info("Starting '{}' on template '{}' for {}", operationName.value(), template.name(), identity);
        try {
            runPre(template, operation, staged);

            cycle.transition(RotationPhase.EXECUTING);
            ExecutorResult result = retryPolicy.execute(() -> dispatcher.dispatch(operation, staged, signal), signal);

            cycle.transition(RotationPhase.EXTRACTING);
            SetterResult extracted = extractor.applyAll(operation.setter(), result, template, staged);
            commitToStage(template, extracted.values(), staged);

            if (operationName == OperationName.SET && template.supports(OperationName.TEST)) {
                cycle.transition(RotationPhase.TESTING);
                verify(template, staged, signal);
            }

            cycle.transition(RotationPhase.COMMITTED);
        } catch (RotationException e) {
            handleFailure(template, operationName, staged, cycle, identity, signal, e);
            throw e;
        } catch (RuntimeException e) {
            ExecutorException wrapped = new ExecutorException("Unexpected failure during " + cycle.phase() + ": "
                    + staged.redact(e.getMessage()), e, false);
            handleFailure(template, operationName, staged, cycle, identity, signal, wrapped);
            throw wrapped;
        }

        RotationResult committed = new RotationResult(
                toMap(staged.snapshot(Namespace.OUTPUTS)),
                toMap(staged.snapshot(Namespace.INTERNAL)));
        audit(template, operationName, "success", identity, null, null, null);
        log.info("Committed '{}' on template '{}' for {}", operationName.value(), template.name(), identity);
        return committed;
    }

    private void handleFailure(ProviderTemplate template, OperationName operationName, RotationContext staged,
                               RotationCycle cycle, Map<String, Object> identity, CancellationSignal signal,
                               RotationException error) {
        RotationPhase failedIn = cycle.phase();
        fail(cycle, error);
        log.warn("'{}' on template '{}' failed during {}: [{}] {}", operationName.value(), template.name(),
                failedIn, error.kind(), staged.redact(error.getMessage()));

        String rollbackOutcome = null;
        if (shouldRollback(template, operationName, failedIn, signal, error)) {
            rollbackOutcome = rollback(template, staged, cycle, identity, signal, error);
        } else if (operationName == OperationName.SET && signal.isCancelled()) {
            log.info("Cycle was cancelled; skipping rollback for template '{}'", template.name());
        }
        audit(template, operationName, "failure", identity, error, rollbackOutcome, staged.redact(error.getMessage()));
    }

    /**
     * A {@code set} that failed once its call may have reached the remote system. A resolution failure
     * means no request was issued.
     */
    private static boolean shouldRollback(ProviderTemplate template, OperationName operationName,
                                          RotationPhase failedIn, CancellationSignal signal, RotationException error) {
        return operationName == OperationName.SET
                && (failedIn == RotationPhase.EXECUTING || failedIn == RotationPhase.EXTRACTING
                || failedIn == RotationPhase.TESTING)
                && !(error instanceof ResolutionException)
                && template.supports(OperationName.REMOVE)
                && !signal.isCancelled();
    }

    private String rollback(ProviderTemplate template, RotationContext staged, RotationCycle cycle,
                            Map<String, Object> identity, CancellationSignal signal, RotationException primary) {
        cycle.transition(RotationPhase.ROLLING_BACK);
        // Only what this cycle produced; a seeded id belongs to the live credential.
        RotationContext rollbackContext = staged.writtenOnly();
        if (primary instanceof ExtractionException extraction) {
            extraction.partial().forEach(rollbackContext::write);
        }
        Operation remove = template.operation(OperationName.REMOVE).orElseThrow();
        String outcome;
        try {
            runOnce(template, remove, rollbackContext, signal);
            outcome = "success";
            log.info("Rolled back partial set on template '{}'", template.name());
        } catch (RotationException e) {
            RollbackException failure = new RollbackException(template.name(), e);
            failure.failedAt(RotationPhase.ROLLING_BACK);
            primary.attachRollbackFailure(failure);
            outcome = "failure";
            log.error("Rollback of partial set on template '{}' failed: {}", template.name(),
                    rollbackContext.redact(e.getMessage()));
        } catch (RuntimeException e) {
            RollbackException failure = new RollbackException(template.name(),
                    new ExecutorException(rollbackContext.redact(e.getMessage()), e, false));
            failure.failedAt(RotationPhase.ROLLING_BACK);
            primary.attachRollbackFailure(failure);
            outcome = "failure";
            log.error("Rollback of partial set on template '{}' failed unexpectedly", template.name(), e);
        }
        cycle.transition(RotationPhase.FAILED);
        auditHelper.logInternalEvent(AUDIT_TYPE, "rollback", outcome, null, auditData(template, OperationName.REMOVE, identity));
        return outcome;
    }

    /**
     * Runs the template's {@code test} against a copy of the staged state. Not retried.
     */
    private void verify(ProviderTemplate template, RotationContext staged, CancellationSignal signal) {
        Operation test = template.operation(OperationName.TEST).orElseThrow();
        try {
            runOnce(template, test, staged.copy(), signal);
            log.debug("Verification passed for template '{}'", template.name());
        } catch (RotationException e) {
            throw new TestFailedException(template.name(), e);
        }
    }

    /**
     * Pre, one call without retry, setters; all against the given scratch context.
     */
    private void runOnce(ProviderTemplate template, Operation operation, RotationContext context, CancellationSignal signal) {
        runPre(template, operation, context);
        ExecutorResult result = dispatcher.dispatch(operation, context, signal);
        SetterResult extracted = extractor.applyAll(operation.setter(), result, template, context);
        commitToStage(template, extracted.values(), context);
    }

    private void runPre(ProviderTemplate template, Operation operation, RotationContext context) {
        for (Map.Entry<String, Assignment> entry : operation.pre().entrySet()) {
            FieldRef target = FieldRef.parse(entry.getKey());
            FieldSchema schema = template.field(target)
                    .orElseThrow(() -> new ResolutionException("Pre target '" + target + "' is not declared"));
            JsonNode value = assign(entry.getValue(), target, context);
            try {
                value = schema.type().coerce(value);
            } catch (IllegalArgumentException e) {
                throw new ResolutionException("Pre assignment to '" + target + "' has the wrong type: " + e.getMessage(), e);
            }
            if (schema.sensitive()) {
                context.registerSecret(value);
            }
            context.write(target, value);
        }
    }

    private JsonNode assign(Assignment assignment, FieldRef target, RotationContext context) {
        if (assignment instanceof Assignment.RandomAssignment random) {
            String value = randomGenerator.generate(random.length(), random.charset());
            context.registerSecret(value);
            return TextNode.valueOf(value);
        }
        if (assignment instanceof Assignment.AlternateAssignment alternate) {
            return TextNode.valueOf(alternate(alternate, target, context));
        }
        Assignment.ValueAssignment value = (Assignment.ValueAssignment) assignment;
        return TextNode.valueOf(expressionEngine.resolve(value.value(), context));
    }

    private static String alternate(Assignment.AlternateAssignment alternate, FieldRef target, RotationContext context) {
        List<String> candidates = alternate.candidates().stream()
                .map(candidate -> context.get(FieldRef.parse(candidate))
                        .map(JsonNode::asText)
                        .filter(text -> !text.isEmpty())
                        .orElseThrow(() -> new ResolutionException("Alternate candidate '" + candidate + "' has no value")))
                .toList();
        Optional<String> current = context.get(target).map(JsonNode::asText);
        int index = current.map(candidates::indexOf).orElse(-1);
        String next = candidates.get((index + 1) % candidates.size());
        log.debug("Alternating '{}' to candidate {} of {}", target, candidates.indexOf(next) + 1, candidates.size());
        return next;
    }

    private static void commitToStage(ProviderTemplate template, Map<FieldRef, JsonNode> values, RotationContext context) {
        values.forEach((ref, value) -> {
            if (template.field(ref).map(FieldSchema::sensitive).orElse(false)) {
                context.registerSecret(value);
            }
            context.write(ref, value);
        });
    }

    private static void registerSensitive(ProviderTemplate template, RotationContext context) {
        for (Namespace namespace : List.of(Namespace.INPUTS, Namespace.INTERNAL)) {
            for (String field : template.sensitiveFields(namespace)) {
                context.lookup(namespace, field).ifPresent(context::registerSecret);
            }
        }
    }

    private static void fail(RotationCycle cycle, RotationException error) {
        error.failedAt(cycle.phase());
        cycle.transition(RotationPhase.FAILED);
    }

    private Map<String, Object> toMap(ObjectNode node) {
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    /**
     * Non-sensitive identity input values, for logs and audit.
     */
    private static Map<String, Object> identityOf(ProviderTemplate template, ObjectNode inputs) {
        Map<String, Object> identity = new LinkedHashMap<>();
        if (inputs == null) {
            return identity;
        }
        for (String field : template.identityFields()) {
            boolean sensitive = Optional.ofNullable(template.inputs().get(field)).map(FieldSchema::sensitive).orElse(true);
            JsonNode value = inputs.get(field);
            if (!sensitive && value != null && value.isValueNode()) {
                identity.put(field, value.asText());
            }
        }
        return identity;
    }

    private Map<String, Object> auditData(ProviderTemplate template, OperationName operationName, Map<String, Object> identity) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("template", template.name());
        data.put("operation", operationName.value());
        data.put("identity", identity);
        return data;
    }

    private void audit(ProviderTemplate template, OperationName operationName, String outcome,
                       Map<String, Object> identity, RotationException error, String rollbackOutcome, String message) {
        Map<String, Object> data = auditData(template, operationName, identity);
        if (error != null) {
            data.put("kind", error.kind().name());
            error.phase().ifPresent(phase -> data.put("phase", phase.name()));
            data.put("error", message);
        }
        if (rollbackOutcome != null) {
            data.put("rollback", rollbackOutcome);
        }
        auditHelper.logInternalEvent(AUDIT_TYPE, operationName.value(), outcome, null, data);
    }
}
