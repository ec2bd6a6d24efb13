package tech.yump.rotator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.rotator.template.FieldSchema;
import tech.yump.rotator.template.OperationName;
import tech.yump.rotator.template.ProviderTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Schema(description = "Catalog entry of a provider template. The internal schema is not exposed.")
public record TemplateSummary(
        @Schema(description = "Template name used in rotation requests.", example = "postgres", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,
        String title,
        String description,
        @Schema(description = "Input fields the caller must or may supply.")
        Map<String, Field> inputs,
        @Schema(description = "Output fields produced by a rotation.")
        Map<String, Field> outputs,
        @Schema(description = "Operations the template defines.", example = "[\"set\", \"test\"]")
        List<String> operations
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "Declaration of one field. Defaults of sensitive fields are omitted.")
    public record Field(
            String type,
            boolean required,
            boolean sensitive,
            @JsonProperty("default")
            JsonNode defaultValue,
            String description
    ) {
        static Field from(FieldSchema schema) {
            return new Field(
                    schema.type().value(),
                    schema.required(),
                    schema.sensitive(),
                    schema.sensitive() || !schema.hasDefault() ? null : schema.defaultValue(),
                    schema.description());
        }
    }

    public static TemplateSummary from(ProviderTemplate template) {
        return new TemplateSummary(
                template.name(),
                template.title(),
                template.description(),
                fields(template.inputs()),
                fields(template.outputs()),
                template.functions().keySet().stream().map(OperationName::value).toList());
    }

    private static Map<String, Field> fields(Map<String, FieldSchema> schemas) {
        Map<String, Field> fields = new LinkedHashMap<>();
        schemas.forEach((name, schema) -> fields.put(name, Field.from(schema)));
        return fields;
    }
}
