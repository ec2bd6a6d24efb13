package tech.yump.rotator.expression;

/**
 * Encodes a resolved value before it is substituted into a template.
 */
@FunctionalInterface
public interface TokenEncoder {

    TokenEncoder IDENTITY = (value, precedingTemplate) -> value;

    /**
     * @param value             the resolved value.
     * @param precedingTemplate the raw template text before the token, for position-aware encoders.
     * @return the text to substitute.
     * @throws IllegalArgumentException if the value cannot be placed at this position.
     *                                  The message must not contain the value.
     */
    String encode(String value, String precedingTemplate);
}
