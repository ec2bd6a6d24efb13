package tech.yump.rotator.template;

import java.util.List;

/**
 * A template document could not be read or is inconsistent. Raised while the registry loads,
 * so a broken catalog stops the application from starting.
 */
public class TemplateDefinitionException extends RuntimeException {

    private final List<String> problems;

    public TemplateDefinitionException(String source, List<String> problems) {
        super("Invalid provider template " + source + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public TemplateDefinitionException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    public List<String> problems() {
        return problems;
    }
}
