package tech.yump.rotator.template;

import java.util.Optional;

/**
 * The three value namespaces of a rotation.
 */
public enum Namespace {
    /** Caller supplied, read-only. */
    INPUTS("inputs"),
    /** Scratch state persisted by the caller between rotations, never exported. */
    INTERNAL("internal"),
    /** The new public secret produced by a rotation. */
    OUTPUTS("outputs");

    private final String key;

    Namespace(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Namespace> fromKey(String key) {
        for (Namespace namespace : values()) {
            if (namespace.key.equals(key)) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }
}
