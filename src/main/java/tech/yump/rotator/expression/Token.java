package tech.yump.rotator.expression;

import tech.yump.rotator.crypto.CharacterSet;
import tech.yump.rotator.template.Namespace;

/**
 * A parsed {@code ${...}} expression.
 */
public sealed interface Token permits Token.PathToken, Token.RandomToken {

    /**
     * The raw text between {@code ${} and {@code }}, used in error messages.
     */
    String expression();

    /**
     * {@code scope.path}: a dotted lookup into one namespace.
     */
    record PathToken(String expression, Namespace namespace, String path) implements Token {

        public String rootField() {
            int dot = path.indexOf('.');
            return dot < 0 ? path : path.substring(0, dot);
        }
    }

    /**
     * {@code random | N [| charset]}: a fresh random string at every occurrence.
     */
    record RandomToken(String expression, int length, CharacterSet charset) implements Token {
    }

    /**
     * Parses the content of one {@code ${...}} token.
     *
     * @throws IllegalArgumentException if the expression is malformed.
     */
    static Token parse(String expression) {
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("empty expression");
        }
        if (trimmed.contains("|")) {
            return parseRandom(expression, trimmed);
        }
        int dot = trimmed.indexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1) {
            throw new IllegalArgumentException("expected <scope>.<path>");
        }
        String scope = trimmed.substring(0, dot);
        Namespace namespace = Namespace.fromKey(scope)
                .orElseThrow(() -> new IllegalArgumentException("unknown scope '" + scope + "'"));
        String path = trimmed.substring(dot + 1);
        for (String segment : path.split("\\.", -1)) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("empty path segment");
            }
        }
        return new PathToken(expression, namespace, path);
    }

    private static Token parseRandom(String expression, String trimmed) {
        String[] parts = trimmed.split("\\|", -1);
        if (!"random".equals(parts[0].trim()) || parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("expected 'random | <length> [| <charset>]'");
        }
        int length;
        try {
            length = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("random length must be an integer", e);
        }
        if (length < 1) {
            throw new IllegalArgumentException("random length must be at least 1");
        }
        CharacterSet charset = parts.length == 3 ? CharacterSet.fromValue(parts[2]) : CharacterSet.ALPHANUMERIC;
        return new RandomToken(expression, length, charset);
    }
}
