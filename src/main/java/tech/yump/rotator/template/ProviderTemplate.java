package tech.yump.rotator.template;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative description of how to rotate one kind of external credential.
 * Instances are loaded from JSON documents by the {@link TemplateRegistry} and never change afterwards.
 *
 * @param identity input fields identifying the remote credential; every non-sensitive input when empty.
 */
public record ProviderTemplate(
        @NotBlank(message = "Template name is required.")
        @Pattern(regexp = "[a-z0-9][a-z0-9_-]*", message = "Template name must be lower-case letters, digits, '-' or '_'.")
        String name,
        String title,
        String description,
        Map<String, @Valid FieldSchema> inputs,
        Map<String, @Valid FieldSchema> outputs,
        Map<String, @Valid FieldSchema> internal,
        List<String> identity,
        @NotEmpty(message = "Template must define at least one function.")
        Map<OperationName, @Valid Operation> functions
) {

    public ProviderTemplate {
        inputs = Operation.orderedCopy(inputs);
        outputs = Operation.orderedCopy(outputs);
        internal = Operation.orderedCopy(internal);
        identity = identity == null ? List.of() : List.copyOf(identity);
        functions = functions == null || functions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(functions));
    }

    public Optional<Operation> operation(OperationName name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean supports(OperationName name) {
        return functions.containsKey(name);
    }

    /**
     * Schema map of the given namespace.
     */
    public Map<String, FieldSchema> fields(Namespace namespace) {
        return switch (namespace) {
            case INPUTS -> inputs;
            case INTERNAL -> internal;
            case OUTPUTS -> outputs;
        };
    }

    public Optional<FieldSchema> field(FieldRef ref) {
        return Optional.ofNullable(fields(ref.namespace()).get(ref.field()));
    }

    /**
     * Input field names that identify the remote credential.
     */
    public List<String> identityFields() {
        if (!identity.isEmpty()) {
            return identity;
        }
        return inputs.entrySet().stream()
                .filter(entry -> !entry.getValue().sensitive())
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Names of sensitive fields declared in the given namespace, in declaration order.
     */
    public List<String> sensitiveFields(Namespace namespace) {
        Map<String, FieldSchema> fields = new LinkedHashMap<>(fields(namespace));
        fields.values().removeIf(schema -> !schema.sensitive());
        return List.copyOf(fields.keySet());
    }
}
