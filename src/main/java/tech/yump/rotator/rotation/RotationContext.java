package tech.yump.rotator.rotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import tech.yump.rotator.template.FieldRef;
import tech.yump.rotator.template.Namespace;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Value bag of one rotation cycle: {@code inputs}, {@code internal} and {@code outputs}.
 * Inputs are never written. Also tracks every secret value seen during the cycle so that
 * messages leaving the engine can be redacted.
 * <p>
 * Not thread-safe; a context belongs to a single cycle.
 */
public final class RotationContext {

    static final String REDACTED = "****";

    private final ObjectNode inputs;
    private final ObjectNode internal;
    private final ObjectNode outputs;
    private final Set<String> secrets;
    private final Set<FieldRef> written;

    private RotationContext(ObjectNode inputs, ObjectNode internal, ObjectNode outputs, Set<String> secrets,
                            Set<FieldRef> written) {
        this.inputs = inputs;
        this.internal = internal;
        this.outputs = outputs;
        this.secrets = secrets;
        this.written = written;
    }

    /**
     * Creates a context owning deep copies of the given namespaces, with empty outputs.
     */
    public static RotationContext of(ObjectNode inputs, ObjectNode internal) {
        return new RotationContext(
                inputs == null ? JsonNodeFactory.instance.objectNode() : inputs.deepCopy(),
                internal == null ? JsonNodeFactory.instance.objectNode() : internal.deepCopy(),
                JsonNodeFactory.instance.objectNode(),
                new LinkedHashSet<>(),
                new LinkedHashSet<>());
    }

    public static RotationContext empty() {
        return of(null, null);
    }

    /**
     * Looks up a dotted path in a namespace. Numeric segments index into arrays.
     *
     * @return the value, or empty if any segment is missing or the value is JSON null.
     */
    public Optional<JsonNode> lookup(Namespace namespace, String path) {
        JsonNode current = namespace(namespace);
        for (String segment : path.split("\\.")) {
            if (current == null) {
                return Optional.empty();
            }
            if (current.isArray()) {
                Optional<Integer> index = parseIndex(segment);
                current = index.isPresent() ? current.get(index.get()) : null;
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                return Optional.empty();
            }
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    public Optional<JsonNode> get(FieldRef ref) {
        return lookup(ref.namespace(), ref.field());
    }

    /**
     * Writes a top-level field of {@code internal} or {@code outputs}.
     *
     * @throws IllegalArgumentException when writing {@code inputs}.
     */
    public void write(FieldRef ref, JsonNode value) {
        if (ref.namespace() == Namespace.INPUTS) {
            throw new IllegalArgumentException("Inputs are read-only, cannot write '" + ref + "'");
        }
        namespace(ref.namespace()).set(ref.field(), value);
        written.add(ref);
    }

    /**
     * Deep copy of this context, including the known secrets.
     */
    public RotationContext copy() {
        return new RotationContext(inputs.deepCopy(), internal.deepCopy(), outputs.deepCopy(),
                new LinkedHashSet<>(secrets), new LinkedHashSet<>(written));
    }

    /**
     * Copy with the inputs and only the internal and output fields written through {@link #write}.
     * Internal values seeded from a previous cycle are left out.
     */
    public RotationContext writtenOnly() {
        ObjectNode freshInternal = JsonNodeFactory.instance.objectNode();
        ObjectNode freshOutputs = JsonNodeFactory.instance.objectNode();
        for (FieldRef ref : written) {
            ObjectNode target = ref.namespace() == Namespace.INTERNAL ? freshInternal : freshOutputs;
            JsonNode value = namespace(ref.namespace()).get(ref.field());
            if (value != null) {
                target.set(ref.field(), value.deepCopy());
            }
        }
        return new RotationContext(inputs.deepCopy(), freshInternal, freshOutputs,
                new LinkedHashSet<>(secrets), new LinkedHashSet<>(written));
    }

    /**
     * Snapshot document {@code {"inputs": .., "internal": .., "outputs": ..}}.
     */
    public ObjectNode document() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.set(Namespace.INPUTS.key(), inputs.deepCopy());
        document.set(Namespace.INTERNAL.key(), internal.deepCopy());
        document.set(Namespace.OUTPUTS.key(), outputs.deepCopy());
        return document;
    }

    /**
     * Snapshot of one namespace.
     */
    public ObjectNode snapshot(Namespace namespace) {
        return namespace(namespace).deepCopy();
    }

    /**
     * Remembers a value that must never appear in logs or error messages.
     */
    public void registerSecret(String value) {
        if (value != null && !value.isBlank()) {
            secrets.add(value);
        }
    }

    public void registerSecret(JsonNode value) {
        if (value == null) {
            return;
        }
        if (value.isContainerNode()) {
            value.forEach(this::registerSecret);
        } else if (!value.isNull()) {
            registerSecret(value.asText());
        }
    }

    /**
     * Replaces every known secret in the text.
     */
    public String redact(String text) {
        if (text == null || secrets.isEmpty()) {
            return text;
        }
        String redacted = text;
        // Longest first, so a secret containing another is replaced whole.
        for (String secret : secrets.stream().sorted(Comparator.comparingInt(String::length).reversed()).toList()) {
            redacted = redacted.replace(secret, REDACTED);
        }
        return redacted;
    }

    private ObjectNode namespace(Namespace namespace) {
        return switch (namespace) {
            case INPUTS -> inputs;
            case INTERNAL -> internal;
            case OUTPUTS -> outputs;
        };
    }

    private static Optional<Integer> parseIndex(String segment) {
        try {
            return Optional.of(Integer.parseInt(segment));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
