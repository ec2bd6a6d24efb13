package tech.yump.rotator.rotation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of one rotation cycle and the transitions allowed between them.
 */
public enum RotationPhase {
    IDLE,
    PREPARING,
    EXECUTING,
    EXTRACTING,
    TESTING,
    COMMITTED,
    FAILED,
    ROLLING_BACK;

    /**
     * @return true if a cycle in this phase may move to {@code next}.
     */
    public boolean canTransitionTo(RotationPhase next) {
        return successors().contains(next);
    }

    private Set<RotationPhase> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(PREPARING);
            case PREPARING -> EnumSet.of(EXECUTING, FAILED);
            case EXECUTING -> EnumSet.of(EXTRACTING, FAILED);
            case EXTRACTING -> EnumSet.of(TESTING, COMMITTED, FAILED);
            case TESTING -> EnumSet.of(COMMITTED, FAILED);
            case FAILED -> EnumSet.of(ROLLING_BACK);
            case ROLLING_BACK -> EnumSet.of(FAILED);
            case COMMITTED -> EnumSet.noneOf(RotationPhase.class);
        };
    }
}
