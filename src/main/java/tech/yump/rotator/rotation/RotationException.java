package tech.yump.rotator.rotation;

import java.util.Optional;

/**
 * Base exception for every failure surfaced by the rotation engine.
 * Messages never contain the secret values being rotated.
 */
public class RotationException extends RuntimeException {

    private final RotationErrorKind kind;
    private RotationPhase phase;
    private RollbackException rollbackFailure;

    public RotationException(RotationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RotationException(RotationErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RotationErrorKind kind() {
        return kind;
    }

    /**
     * The phase the cycle was in when this error occurred, once the orchestrator has surfaced it.
     */
    public Optional<RotationPhase> phase() {
        return Optional.ofNullable(phase);
    }

    /**
     * A failure of the best-effort rollback that followed this error, if any.
     */
    public Optional<RollbackException> rollbackFailure() {
        return Optional.ofNullable(rollbackFailure);
    }

    void failedAt(RotationPhase phase) {
        if (this.phase == null) {
            this.phase = phase;
        }
    }

    void attachRollbackFailure(RollbackException failure) {
        this.rollbackFailure = failure;
        addSuppressed(failure);
    }
}
