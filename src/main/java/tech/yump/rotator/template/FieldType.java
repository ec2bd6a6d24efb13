package tech.yump.rotator.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * JSON type of a template field, with the coercions accepted for caller-supplied values.
 */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FieldType fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown field type: '" + value + "'", e);
        }
    }

    public boolean isScalar() {
        return this == STRING || this == NUMBER || this == BOOLEAN;
    }

    /**
     * Coerces a non-null JSON value to this type.
     * Strings are accepted for numbers and booleans, and scalars are accepted for strings.
     *
     * @return the coerced value.
     * @throws IllegalArgumentException if the value cannot be represented as this type.
     *                                  The message never contains the value itself.
     */
    public JsonNode coerce(JsonNode value) {
        switch (this) {
            case STRING:
                if (value.isTextual()) {
                    return value;
                }
                if (value.isNumber() || value.isBoolean()) {
                    return TextNode.valueOf(value.asText());
                }
                break;
            case NUMBER:
                if (value.isNumber()) {
                    return value;
                }
                if (value.isTextual()) {
                    return parseNumber(value.asText());
                }
                break;
            case BOOLEAN:
                if (value.isBoolean()) {
                    return value;
                }
                if (value.isTextual()) {
                    String text = value.asText().trim();
                    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                        return BooleanNode.valueOf(Boolean.parseBoolean(text.toLowerCase(Locale.ROOT)));
                    }
                }
                break;
            case ARRAY:
                if (value.isArray()) {
                    return value;
                }
                break;
            case OBJECT:
                if (value.isObject()) {
                    return value;
                }
                break;
        }
        throw new IllegalArgumentException("expected " + value() + " but got " + value.getNodeType().name().toLowerCase(Locale.ROOT));
    }

    private static JsonNode parseNumber(String text) {
        try {
            BigDecimal number = new BigDecimal(text.trim());
            try {
                return JsonNodeFactory.instance.numberNode(number.longValueExact());
            } catch (ArithmeticException notIntegral) {
                return JsonNodeFactory.instance.numberNode(number);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected number but got a non-numeric string", e);
        }
    }
}
