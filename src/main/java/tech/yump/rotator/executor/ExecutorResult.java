package tech.yump.rotator.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structured result of one remote operation, queried by setter paths.
 * The content may hold secrets beyond the declared setter fields; it is never logged,
 * and {@link #toString()} does not render it.
 *
 * @param status  HTTP status code, or 0 for database results.
 * @param headers response headers, names lower-cased.
 * @param body    parsed response body, or the rows / update count of a database statement.
 */
public record ExecutorResult(int status, Map<String, List<String>> headers, JsonNode body) {

    public ExecutorResult {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> normalized.put(name.toLowerCase(Locale.ROOT), List.copyOf(values)));
        }
        headers = Map.copyOf(normalized);
        if (body == null) {
            body = JsonNodeFactory.instance.objectNode();
        }
    }

    public static ExecutorResult ofBody(JsonNode body) {
        return new ExecutorResult(0, Map.of(), body);
    }

    /**
     * Headers as a JSON object of lower-cased name to first value.
     */
    public ObjectNode headersDocument() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                document.put(name, values.get(0));
            }
        });
        return document;
    }

    @Override
    public String toString() {
        return "ExecutorResult[status=" + status + ", headers=" + headers.size() + ", body=<redacted>]";
    }
}
