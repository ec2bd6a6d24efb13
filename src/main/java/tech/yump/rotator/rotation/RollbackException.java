package tech.yump.rotator.rotation;

/**
 * Secondary failure of the best-effort {@code remove} that follows a failed {@code set}.
 * Always attached to the primary error, never thrown in its place.
 */
public class RollbackException extends RotationException {
    public RollbackException(String templateName, RotationException cause) {
        super(RotationErrorKind.ROLLBACK,
                "Rollback (remove) failed for template '" + templateName + "': " + cause.getMessage(),
                cause);
    }
}
