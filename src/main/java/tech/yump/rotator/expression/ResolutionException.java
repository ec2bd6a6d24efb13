package tech.yump.rotator.expression;

import tech.yump.rotator.rotation.RotationErrorKind;
import tech.yump.rotator.rotation.RotationException;

/**
 * Thrown when a template token cannot be resolved to a non-empty value.
 * The message names the token, never a resolved value.
 */
public class ResolutionException extends RotationException {

    public ResolutionException(String message) {
        super(RotationErrorKind.RESOLUTION, message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(RotationErrorKind.RESOLUTION, message, cause);
    }
}
