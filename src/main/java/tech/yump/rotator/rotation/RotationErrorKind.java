package tech.yump.rotator.rotation;

/**
 * Originating kind of a {@link RotationException}.
 */
public enum RotationErrorKind {
    /** Missing, undeclared or non-coercible inputs, or an operation the template does not define. */
    VALIDATION,
    /** A template token could not be resolved to a non-empty value. */
    RESOLUTION,
    /** The remote call failed: non-2xx status, connection or statement failure, timeout, cancellation. */
    EXECUTOR,
    /** A setter path matched nothing, or was ambiguous. */
    EXTRACTION,
    /** The post-rotation verification failed. */
    TEST_FAILED,
    /** The best-effort removal after a failed set failed as well. */
    ROLLBACK,
    TEMPLATE_NOT_FOUND,
    /** Another cycle for the same credential is in flight. */
    ROTATION_IN_PROGRESS
}
