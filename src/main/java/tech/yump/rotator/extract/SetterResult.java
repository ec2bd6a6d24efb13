package tech.yump.rotator.extract;

import com.fasterxml.jackson.databind.JsonNode;
import tech.yump.rotator.template.FieldRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values extracted by a complete setter map, in setter order.
 */
public record SetterResult(Map<FieldRef, JsonNode> values) {

    public SetterResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static SetterResult empty() {
        return new SetterResult(Map.of());
    }

    @Override
    public String toString() {
        return "SetterResult" + values.keySet();
    }
}
