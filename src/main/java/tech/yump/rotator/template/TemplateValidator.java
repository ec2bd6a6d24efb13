package tech.yump.rotator.template;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tech.yump.rotator.expression.ExpressionEngine;
import tech.yump.rotator.expression.ResolutionException;
import tech.yump.rotator.expression.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a parsed template for consistency before it enters the catalog.
 * Bean Validation covers the shape of the document; the semantic checks make sure every
 * token, assignment and setter refers to a declared field of the right namespace.
 */
@Component
@RequiredArgsConstructor
public class TemplateValidator {

    private final Validator validator;

    /**
     * @return the problems found, empty when the template is valid.
     */
    public List<String> validate(ProviderTemplate template) {
        List<String> problems = new ArrayList<>();

        Set<ConstraintViolation<ProviderTemplate>> violations = validator.validate(template);
        violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> problems.add(v.getPropertyPath() + ": " + v.getMessage()));
        if (!problems.isEmpty()) {
            return problems;
        }

        if (!template.supports(OperationName.SET)) {
            problems.add("functions: 'set' is mandatory");
        }
        for (String identityField : template.identity()) {
            if (!template.inputs().containsKey(identityField)) {
                problems.add("identity: '" + identityField + "' is not a declared input");
            }
        }
        template.functions().forEach((name, operation) -> validateOperation(template, name, operation, problems));
        return problems;
    }

    private void validateOperation(ProviderTemplate template, OperationName name, Operation operation, List<String> problems) {
        String prefix = "functions." + name.value();

        operation.pre().forEach((key, assignment) -> {
            FieldRef target = parseRef(key, prefix + ".pre", problems);
            if (target == null) {
                return;
            }
            if (target.namespace() != Namespace.INTERNAL) {
                problems.add(prefix + ".pre: '" + key + "' must target the internal namespace");
            } else if (template.field(target).isEmpty()) {
                problems.add(prefix + ".pre: '" + key + "' is not a declared internal field");
            }
            validateAssignment(template, prefix + ".pre." + key, assignment, problems);
        });

        operation.setter().forEach((key, extraction) -> {
            FieldRef target = parseRef(key, prefix + ".setter", problems);
            if (target == null) {
                return;
            }
            if (target.namespace() == Namespace.INPUTS) {
                problems.add(prefix + ".setter: '" + key + "' cannot write inputs");
            } else if (template.field(target).isEmpty()) {
                problems.add(prefix + ".setter: '" + key + "' is not a declared " + target.namespace().key() + " field");
            }
        });

        List<String> templates = operation.accept(new Operation.Visitor<>() {
            @Override
            public List<String> visitHttp(HttpOperation http) {
                List<String> texts = new ArrayList<>(List.of(http.method(), http.url()));
                texts.addAll(http.header().values());
                return texts;
            }

            @Override
            public List<String> visitDb(DbOperation db) {
                List<String> texts = new ArrayList<>(List.of(db.host(), db.port(), db.database(), db.username(), db.password(), db.query()));
                if (db.ssl() != null) {
                    texts.add(db.ssl());
                }
                return texts;
            }
        });
        for (String text : templates) {
            checkTokens(template, prefix, () -> ExpressionEngine.tokens(text), problems);
        }
        if (operation instanceof HttpOperation http && http.hasBody()) {
            checkTokens(template, prefix + ".body", () -> ExpressionEngine.tokens(http.body()), problems);
        }
    }

    private void validateAssignment(ProviderTemplate template, String location, Assignment assignment, List<String> problems) {
        if (assignment instanceof Assignment.ValueAssignment value) {
            checkTokens(template, location, () -> ExpressionEngine.tokens(value.value()), problems);
        } else if (assignment instanceof Assignment.AlternateAssignment alternate) {
            for (String candidate : alternate.candidates()) {
                FieldRef ref = parseRef(candidate, location, problems);
                if (ref != null && template.field(ref).isEmpty()) {
                    problems.add(location + ": candidate '" + candidate + "' is not a declared field");
                }
            }
        }
    }

    private void checkTokens(ProviderTemplate template, String location, TokenSource source, List<String> problems) {
        List<Token> tokens;
        try {
            tokens = source.tokens();
        } catch (ResolutionException e) {
            problems.add(location + ": " + e.getMessage());
            return;
        }
        for (Token token : tokens) {
            if (token instanceof Token.PathToken path) {
                Map<String, FieldSchema> fields = template.fields(path.namespace());
                if (!fields.containsKey(path.rootField())) {
                    problems.add(location + ": token '${" + token.expression() + "}' refers to undeclared field '"
                            + path.namespace().key() + "." + path.rootField() + "'");
                }
            }
        }
    }

    private static FieldRef parseRef(String reference, String location, List<String> problems) {
        try {
            return FieldRef.parse(reference);
        } catch (IllegalArgumentException e) {
            problems.add(location + ": " + e.getMessage());
            return null;
        }
    }

    @FunctionalInterface
    private interface TokenSource {
        List<Token> tokens();
    }
}
