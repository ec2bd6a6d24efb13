package tech.yump.rotator.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotator.crypto.SecureRandomGenerator;
import tech.yump.rotator.rotation.RotationContext;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${scope.path}} and {@code ${random | N}} tokens against a {@link RotationContext}.
 * <p>
 * Resolution is all-or-nothing: an unknown scope, a missing path, a container where text is
 * expected or an empty value fails with {@link ResolutionException}. Random tokens are drawn
 * fresh at every occurrence and registered as secrets of the context.
 * <p>
 * In JSON templates, an object of the single form {@code {"ref": "scope.path"}} is replaced by
 * the referenced value with its own JSON type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpressionEngine {

    static final Pattern TOKEN = Pattern.compile("\\$\\{([^}]*)}");
    static final String REF_KEY = "ref";

    private final SecureRandomGenerator randomGenerator;

    public String resolve(String template, RotationContext context) {
        return resolve(template, context, TokenEncoder.IDENTITY);
    }

    /**
     * Resolves every token of a string template, passing each value through the encoder.
     *
     * @throws ResolutionException if a token is malformed, unresolvable, empty, or rejected by the encoder.
     */
    public String resolve(String template, RotationContext context, TokenEncoder encoder) {
        if (template == null) {
            throw new ResolutionException("Template text is missing");
        }
        Matcher matcher = TOKEN.matcher(template);
        StringBuilder resolved = new StringBuilder(template.length());
        int last = 0;
        while (matcher.find()) {
            resolved.append(template, last, matcher.start());
            String expression = matcher.group(1);
            String value = valueOf(parse(expression), context);
            String encoded;
            try {
                encoded = encoder.encode(value, template.substring(0, matcher.start()));
            } catch (IllegalArgumentException e) {
                throw new ResolutionException("Value of token '${" + expression + "}' cannot be placed here: " + e.getMessage(), e);
            }
            resolved.append(encoded);
            last = matcher.end();
        }
        resolved.append(template, last, template.length());
        return resolved.toString();
    }

    /**
     * Resolves a JSON template. Text leaves are resolved independently; {@code {"ref": ..}} objects
     * are replaced by the referenced value. The template itself is not modified.
     */
    public JsonNode resolve(JsonNode template, RotationContext context) {
        if (template == null || template.isNull() || template.isMissingNode()) {
            return template;
        }
        if (template.isTextual()) {
            return TextNode.valueOf(resolve(template.asText(), context));
        }
        if (isReference(template)) {
            return resolveReference(template.get(REF_KEY).asText(), context);
        }
        if (template.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode(template.size());
            for (JsonNode element : template) {
                array.add(resolve(element, context));
            }
            return array;
        }
        if (template.isObject()) {
            ObjectNode object = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = template.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                object.set(field.getKey(), resolve(field.getValue(), context));
            }
            return object;
        }
        return template.deepCopy();
    }

    /**
     * Tokens of a string template, without resolving them.
     *
     * @throws ResolutionException if a token is malformed.
     */
    public static List<Token> tokens(String template) {
        List<Token> tokens = new ArrayList<>();
        if (template == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(template);
        while (matcher.find()) {
            tokens.add(parse(matcher.group(1)));
        }
        return tokens;
    }

    /**
     * Tokens and references of a JSON template, without resolving them. A reference
     * {@code {"ref": "scope.path"}} is reported as a {@link Token.PathToken}.
     */
    public static List<Token> tokens(JsonNode template) {
        List<Token> tokens = new ArrayList<>();
        collect(template, tokens);
        return tokens;
    }

    private static void collect(JsonNode node, List<Token> tokens) {
        if (node == null) {
            return;
        }
        if (node.isTextual()) {
            tokens.addAll(tokens(node.asText()));
        } else if (isReference(node)) {
            tokens.add(parse(node.get(REF_KEY).asText()));
        } else if (node.isContainerNode()) {
            node.forEach(child -> collect(child, tokens));
        }
    }

    private static boolean isReference(JsonNode node) {
        return node.isObject() && node.size() == 1 && node.has(REF_KEY) && node.get(REF_KEY).isTextual();
    }

    private static Token parse(String expression) {
        try {
            return Token.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new ResolutionException("Malformed token '${" + expression + "}': " + e.getMessage(), e);
        }
    }

    private String valueOf(Token token, RotationContext context) {
        if (token instanceof Token.RandomToken random) {
            String value = randomGenerator.generate(random.length(), random.charset());
            context.registerSecret(value);
            return value;
        }
        Token.PathToken path = (Token.PathToken) token;
        JsonNode node = context.lookup(path.namespace(), path.path())
                .orElseThrow(() -> new ResolutionException("Token '${" + path.expression() + "}' does not resolve to a value"));
        if (node.isContainerNode()) {
            throw new ResolutionException("Token '${" + path.expression() + "}' resolves to a "
                    + (node.isArray() ? "list" : "object") + ", not text");
        }
        String value = node.asText();
        if (value.isEmpty()) {
            throw new ResolutionException("Token '${" + path.expression() + "}' resolves to an empty value");
        }
        return value;
    }

    private JsonNode resolveReference(String expression, RotationContext context) {
        Token token = parse(expression);
        if (!(token instanceof Token.PathToken path)) {
            throw new ResolutionException("Reference '" + expression + "' must be a <scope>.<path> expression");
        }
        JsonNode value = context.lookup(path.namespace(), path.path())
                .orElseThrow(() -> new ResolutionException("Reference '" + expression + "' does not resolve to a value"));
        log.trace("Resolved reference '{}' to a {} value", expression, value.getNodeType());
        return value.deepCopy();
    }
}
