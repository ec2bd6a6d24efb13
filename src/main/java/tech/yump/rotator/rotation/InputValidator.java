package tech.yump.rotator.rotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotator.template.FieldSchema;
import tech.yump.rotator.template.ProviderTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Validates caller-supplied inputs against a template's input schema and seeds the internal
 * namespace from the caller's prior state. Problem descriptions name fields, never values.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputValidator {

    private final ObjectMapper objectMapper;

    /**
     * Rejects undeclared fields, applies defaults, checks required fields and coerces types.
     *
     * @return the validated inputs.
     * @throws InputValidationException listing every problem found.
     */
    public ObjectNode validateInputs(ProviderTemplate template, Map<String, Object> inputs) {
        ObjectNode supplied = toTree(inputs);
        List<String> problems = new ArrayList<>();

        Iterator<String> names = supplied.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!template.inputs().containsKey(name)) {
                problems.add("'" + name + "' is not a declared input");
            }
        }

        ObjectNode validated = objectMapper.createObjectNode();
        for (Map.Entry<String, FieldSchema> field : template.inputs().entrySet()) {
            String name = field.getKey();
            FieldSchema schema = field.getValue();
            JsonNode value = supplied.get(name);
            if (isAbsent(value)) {
                if (schema.hasDefault()) {
                    value = schema.defaultValue().deepCopy();
                } else {
                    if (schema.required()) {
                        problems.add("'" + name + "' is required");
                    }
                    continue;
                }
            }
            try {
                validated.set(name, schema.type().coerce(value));
            } catch (IllegalArgumentException e) {
                problems.add("'" + name + "': " + e.getMessage());
            }
        }

        if (!problems.isEmpty()) {
            log.warn("Rejected inputs for template '{}': {}", template.name(), problems);
            throw new InputValidationException(template.name(), problems);
        }
        return validated;
    }

    /**
     * Builds the internal namespace from prior state. Undeclared keys are dropped; declared
     * fields with a default get it when absent.
     *
     * @throws InputValidationException if a declared field has a value of the wrong type.
     */
    public ObjectNode seedInternal(ProviderTemplate template, Map<String, Object> priorInternal) {
        ObjectNode prior = toTree(priorInternal);
        ObjectNode seeded = objectMapper.createObjectNode();
        List<String> problems = new ArrayList<>();

        Iterator<String> names = prior.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!template.internal().containsKey(name)) {
                log.warn("Dropping undeclared internal field '{}' for template '{}'", name, template.name());
            }
        }

        for (Map.Entry<String, FieldSchema> field : template.internal().entrySet()) {
            FieldSchema schema = field.getValue();
            JsonNode value = prior.get(field.getKey());
            if (isAbsent(value)) {
                if (!schema.hasDefault()) {
                    continue;
                }
                value = schema.defaultValue().deepCopy();
            }
            try {
                seeded.set(field.getKey(), schema.type().coerce(value));
            } catch (IllegalArgumentException e) {
                problems.add("internal '" + field.getKey() + "': " + e.getMessage());
            }
        }

        if (!problems.isEmpty()) {
            throw new InputValidationException(template.name(), problems);
        }
        return seeded;
    }

    private ObjectNode toTree(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.valueToTree(values);
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || (value.isTextual() && value.asText().isEmpty());
    }
}
