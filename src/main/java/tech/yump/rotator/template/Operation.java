package tech.yump.rotator.template;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One remote operation of a template. The set of variants is closed; each variant has
 * exactly one executor, reached through {@link Visitor}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = HttpOperation.class, name = "HTTP"),
        @JsonSubTypes.Type(value = DbOperation.class, name = "DB")
})
public sealed interface Operation permits HttpOperation, DbOperation {

    /**
     * Ordered {@code internal.<field>} to assignment map run before the call.
     */
    Map<String, Assignment> pre();

    /**
     * Ordered {@code outputs.<field>}/{@code internal.<field>} to extraction map applied after the call.
     */
    Map<String, Extraction> setter();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitHttp(HttpOperation operation);

        R visitDb(DbOperation operation);
    }

    static <V> Map<String, V> orderedCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
