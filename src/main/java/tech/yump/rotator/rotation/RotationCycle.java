package tech.yump.rotator.rotation;

import lombok.extern.slf4j.Slf4j;
import tech.yump.rotator.template.OperationName;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase bookkeeping of one cycle. Every transition is checked against
 * {@link RotationPhase#canTransitionTo(RotationPhase)}.
 */
@Slf4j
final class RotationCycle {

    private final String templateName;
    private final OperationName operation;
    private final List<RotationPhase> history = new ArrayList<>();
    private RotationPhase phase = RotationPhase.IDLE;
    private RotationPhase failedAt;

    RotationCycle(String templateName, OperationName operation) {
        this.templateName = templateName;
        this.operation = operation;
        history.add(phase);
    }

    /**
     * @throws IllegalStateException for a transition the state machine does not allow.
     */
    void transition(RotationPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal rotation phase transition " + phase + " -> " + next
                    + " for template '" + templateName + "' operation '" + operation.value() + "'");
        }
        if (next == RotationPhase.FAILED && failedAt == null) {
            failedAt = phase;
        }
        log.debug("Template '{}' operation '{}': {} -> {}", templateName, operation.value(), phase, next);
        phase = next;
        history.add(next);
    }

    RotationPhase phase() {
        return phase;
    }

    /**
     * The phase in which the cycle first failed, or null if it has not failed.
     */
    RotationPhase failedAt() {
        return failedAt;
    }

    List<RotationPhase> history() {
        return List.copyOf(history);
    }
}
