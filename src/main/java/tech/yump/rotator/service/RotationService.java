package tech.yump.rotator.service;

import tech.yump.rotator.rotation.RotationException;
import tech.yump.rotator.rotation.RotationResult;
import tech.yump.rotator.template.OperationName;

import java.util.List;
import java.util.Map;

/**
 * Service layer interface for running credential rotations.
 */
public interface RotationService {

    /**
     * Number of committed generations kept: the current one and the one before it.
     */
    int MAX_GENERATIONS = 2;

    /**
     * Runs a single operation of a template.
     *
     * @param templateName  The provider template.
     * @param operation     {@code set}, {@code test} or {@code remove}.
     * @param inputs        Caller inputs, validated against the template.
     * @param priorInternal Internal state from the previous cycle.
     * @return The committed outputs and internal state.
     * @throws RotationException If the operation fails; nothing is committed.
     */
    RotationResult runOperation(String templateName, OperationName operation,
                                Map<String, Object> inputs, Map<String, Object> priorInternal);

    /**
     * Rotates the credential and maintains the generation history.
     * The new generation becomes current; generations beyond {@link #MAX_GENERATIONS} are retired through
     * the template's {@code remove}, when it has one. A failed retirement is reported, it never undoes
     * the rotation; the generations that could not be removed are returned after the kept ones.
     *
     * @param templateName The provider template.
     * @param inputs       Caller inputs, validated against the template.
     * @param generations  Committed generations, newest first. May be empty.
     * @return The new generation history and the retirement outcome.
     * @throws RotationException If the rotation itself fails; the history is then unchanged.
     */
    RotationCycleOutcome rotate(String templateName, Map<String, Object> inputs, List<CredentialGeneration> generations);
}
