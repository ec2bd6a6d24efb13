package tech.yump.rotator.rotation;

/**
 * Thrown when a cycle is requested for a credential that already has one in flight.
 */
public class RotationInProgressException extends RotationException {
    public RotationInProgressException(String templateName) {
        super(RotationErrorKind.ROTATION_IN_PROGRESS,
                "A rotation for this credential of template '" + templateName + "' is already in progress");
    }
}
