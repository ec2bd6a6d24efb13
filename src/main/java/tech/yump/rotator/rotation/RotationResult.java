package tech.yump.rotator.rotation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Committed state of a successful cycle: the new public {@code outputs} and the {@code internal}
 * state the caller persists and passes back as {@code priorInternal} next time.
 */
public record RotationResult(Map<String, Object> outputs, Map<String, Object> internal) {

    public RotationResult {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        internal = internal == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(internal));
    }

    @Override
    public String toString() {
        return "RotationResult[outputs=" + outputs.keySet() + ", internal=" + internal.keySet() + "]";
    }
}
