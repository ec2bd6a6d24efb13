package tech.yump.rotator.service;

import java.util.List;

/**
 * Result of a full rotation cycle.
 *
 * @param generations     committed generations, newest first. At most {@link RotationService#MAX_GENERATIONS},
 *                        unless retirement failed: the generations still live remotely are then kept at the end.
 * @param retirement      what happened to the generation(s) pushed out of the history.
 * @param retirementError redacted reason when retirement failed.
 */
public record RotationCycleOutcome(
        List<CredentialGeneration> generations,
        RetirementStatus retirement,
        String retirementError
) {
    public RotationCycleOutcome {
        generations = List.copyOf(generations);
    }

    public CredentialGeneration current() {
        return generations.get(0);
    }
}
