package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.rotator.rotation.RotationResult;

import java.util.Map;

@Schema(description = "Committed state of a successful operation.")
public record RotationResponse(
        @Schema(description = "New public outputs.", requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Object> outputs,

        @Schema(description = "Internal state to persist and send back on the next rotation. Never expose to consumers.",
                requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Object> internal
) {
    public static RotationResponse from(RotationResult result) {
        return new RotationResponse(result.outputs(), result.internal());
    }
}
