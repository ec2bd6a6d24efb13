package tech.yump.rotator.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum OperationName {
    SET,
    REMOVE,
    TEST;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OperationName fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown operation: '" + value + "'"));
    }

    public static Optional<OperationName> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (OperationName name : values()) {
            if (name.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
