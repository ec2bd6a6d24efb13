package tech.yump.rotator.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Character sets available to the {@link SecureRandomGenerator}.
 * Each set is made of character classes; a generated string contains at least one
 * character of every class when its length allows.
 */
public enum CharacterSet {

    ALPHANUMERIC("alphanumeric", List.of(
            Alphabets.UPPER,
            Alphabets.LOWER,
            Alphabets.DIGITS)),

    FULL("full", List.of(
            Alphabets.UPPER,
            Alphabets.LOWER,
            Alphabets.DIGITS,
            Alphabets.SYMBOLS));

    private final String value;
    private final List<String> classes;
    private final String alphabet;

    CharacterSet(String value, List<String> classes) {
        this.value = value;
        this.classes = classes;
        this.alphabet = String.join("", classes);
    }

    @JsonValue
    public String value() {
        return value;
    }

    List<String> classes() {
        return classes;
    }

    String alphabet() {
        return alphabet;
    }

    @JsonCreator
    public static CharacterSet fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (CharacterSet set : values()) {
            if (set.value.equals(normalized)) {
                return set;
            }
        }
        throw new IllegalArgumentException("Unknown character set: '" + value + "'");
    }

    private static final class Alphabets {
        static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
        static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
        static final String DIGITS = "0123456789";
        static final String SYMBOLS = "!@#$%^&*()-_=+";
    }
}
