package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Request to run one operation of a provider template.")
public record RotationRequest(
        @Schema(description = "Input values, validated against the template's input schema.",
                example = "{\"admin_api_key\": \"SG.admin\", \"scopes\": [\"mail.send\"]}")
        Map<String, Object> inputs,

        @Schema(description = "Internal state returned by the previous successful rotation.",
                example = "{\"api_key_id\": \"123\"}")
        Map<String, Object> internal
) {
    public RotationRequest {
        inputs = inputs == null ? Map.of() : inputs;
        internal = internal == null ? Map.of() : internal;
    }
}
