package tech.yump.rotator.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Document a setter path is evaluated against.
 */
public enum ExtractionSource {
    /** The executor result body: the parsed HTTP response, or the rows of a DB statement. */
    BODY,
    /** HTTP response headers, lower-cased names mapped to their first value. */
    HEADERS,
    /** The staged rotation context, {@code {"inputs": .., "internal": .., "outputs": ..}}. */
    CONTEXT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExtractionSource fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown extraction source: '" + value + "'", e);
        }
    }
}
