package tech.yump.rotator.rotation;

/**
 * Thrown when the verification that follows a successful {@code set} fails.
 * The cause is the failure of the {@code test} operation itself.
 */
public class TestFailedException extends RotationException {
    public TestFailedException(String templateName, RotationException cause) {
        super(RotationErrorKind.TEST_FAILED,
                "Verification of the rotated credential failed for template '" + templateName + "': " + cause.getMessage(),
                cause);
    }
}
