package tech.yump.rotator.service;

/**
 * What happened to the generation pushed out of the history by a new rotation.
 */
public enum RetirementStatus {
    /** Nothing was pushed out. */
    NONE,
    /** The retired generation was removed on the remote system. */
    REMOVED,
    /** The template has no remove operation; the retired generation was dropped locally. */
    SKIPPED,
    /** Removing a retired generation failed; it stays in the history and the new generation is committed regardless. */
    FAILED
}
