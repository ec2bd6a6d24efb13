package tech.yump.rotator.rotation;

import java.util.List;

/**
 * Thrown when caller-supplied inputs do not satisfy the template's input schema.
 */
public class InputValidationException extends RotationException {

    private final List<String> problems;

    public InputValidationException(String templateName, List<String> problems) {
        super(RotationErrorKind.VALIDATION,
                "Invalid inputs for template '" + templateName + "': " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
