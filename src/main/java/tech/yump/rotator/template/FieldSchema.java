package tech.yump.rotator.template;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

/**
 * Declaration of one field of a template namespace.
 *
 * @param type         JSON type of the value.
 * @param required     whether the caller must supply it (inputs only).
 * @param defaultValue value used when the caller supplies none.
 * @param description  human readable description for catalogs.
 * @param sensitive    whether the value is a secret; sensitive values never reach logs, errors or audit data.
 */
public record FieldSchema(
        @NotNull(message = "Field type is required.")
        FieldType type,
        boolean required,
        @JsonProperty("default")
        JsonNode defaultValue,
        String description,
        boolean sensitive
) {

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isNull() && !defaultValue.isMissingNode();
    }
}
