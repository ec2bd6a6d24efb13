package tech.yump.rotator.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.Extraction;
import tech.yump.rotator.template.FieldRef;
import tech.yump.rotator.template.FieldSchema;
import tech.yump.rotator.template.ProviderTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies setter paths to executor results using Jayway JsonPath over Jackson trees.
 */
@Slf4j
@Component
public class ResponseExtractor {

    private final Configuration jsonPathConfig;

    public ResponseExtractor(ObjectMapper objectMapper) {
        this.jsonPathConfig = Configuration.builder()
                .jsonProvider(new JacksonJsonNodeJsonProvider(objectMapper))
                .mappingProvider(new JacksonMappingProvider(objectMapper))
                .build();
    }

    /**
     * Extracts exactly one value from a result body or headers.
     *
     * @throws ExtractionException if nothing matches, or an indefinite path matches other than one node.
     */
    public JsonNode extract(ExecutorResult result, Extraction rule) {
        return extract(result, rule, null);
    }

    /**
     * Extracts exactly one value, resolving {@code context} sources against the given context.
     *
     * @throws ExtractionException if nothing matches, or an indefinite path matches other than one node.
     */
    public JsonNode extract(ExecutorResult result, Extraction rule, @Nullable RotationContext context) {
        JsonNode document = switch (rule.source()) {
            case BODY -> result.body();
            case HEADERS -> result.headersDocument();
            case CONTEXT -> {
                if (context == null) {
                    throw new ExtractionException("Setter path '" + rule.path() + "' reads the rotation context, which is not available here");
                }
                yield context.document();
            }
        };
        return query(document, rule);
    }

    /**
     * Applies a whole setter map. Either every entry yields a value of its declared type, or
     * {@link ExtractionException} is thrown carrying the values extracted so far; nothing is
     * written to the context here.
     */
    public SetterResult applyAll(Map<String, Extraction> setter, ExecutorResult result,
                                 ProviderTemplate template, RotationContext context) {
        Map<FieldRef, JsonNode> extracted = new LinkedHashMap<>();
        for (Map.Entry<String, Extraction> entry : setter.entrySet()) {
            FieldRef target = FieldRef.parse(entry.getKey());
            try {
                FieldSchema schema = template.field(target)
                        .orElseThrow(() -> new ExtractionException("Setter target '" + target + "' is not declared by template '" + template.name() + "'"));
                JsonNode value = extract(result, entry.getValue(), context);
                extracted.put(target, coerce(target, schema, value));
            } catch (ExtractionException e) {
                log.debug("Setter failed for '{}' after {} successful extraction(s)", target, extracted.size());
                throw e.withPartial(extracted);
            }
        }
        log.debug("Applied {} setter extraction(s) for template '{}'", extracted.size(), template.name());
        return new SetterResult(extracted);
    }

    private JsonNode query(JsonNode document, Extraction rule) {
        String path = normalize(rule.path());
        JsonPath compiled;
        try {
            compiled = JsonPath.compile(path);
        } catch (InvalidPathException e) {
            throw new ExtractionException("Setter path '" + rule.path() + "' is not a valid JSON path", e);
        }
        JsonNode value;
        try {
            value = JsonPath.using(jsonPathConfig).parse(document).read(compiled, JsonNode.class);
        } catch (PathNotFoundException e) {
            throw new ExtractionException("Setter path '" + rule.path() + "' matched nothing in the " + rule.source().value());
        } catch (JsonPathException e) {
            throw new ExtractionException("Setter path '" + rule.path() + "' could not be evaluated against the " + rule.source().value(), e);
        }
        if (!compiled.isDefinite()) {
            if (value == null || !value.isArray() || value.size() != 1) {
                int matches = value == null ? 0 : value.size();
                throw new ExtractionException("Setter path '" + rule.path() + "' must match exactly one node, matched " + matches);
            }
            value = value.get(0);
        }
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new ExtractionException("Setter path '" + rule.path() + "' matched nothing in the " + rule.source().value());
        }
        return value;
    }

    private static JsonNode coerce(FieldRef target, FieldSchema schema, JsonNode value) {
        if (schema.type().isScalar() && value.isContainerNode()) {
            throw new ExtractionException("Setter for '" + target + "' matched a " + (value.isArray() ? "list" : "object")
                    + " where a " + schema.type().value() + " was expected");
        }
        try {
            return schema.type().coerce(value);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Setter for '" + target + "' matched a value of the wrong type: " + e.getMessage());
        }
    }

    private static String normalize(String path) {
        String trimmed = path.trim();
        if (trimmed.startsWith("$")) {
            return trimmed;
        }
        return trimmed.startsWith("[") ? "$" + trimmed : "$." + trimmed;
    }
}
