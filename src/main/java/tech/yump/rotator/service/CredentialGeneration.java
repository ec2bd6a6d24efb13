package tech.yump.rotator.service;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Schema(description = "One committed credential generation: the public outputs and the internal state that produced them.")
public record CredentialGeneration(
        @Schema(description = "Public outputs of the rotation (the credential consumers use).", requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Object> outputs,

        @Schema(description = "Internal state to pass back on the next rotation. Never expose to consumers.", requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Object> internal,

        @Schema(description = "When this generation was committed.")
        Instant rotatedAt
) {
    public CredentialGeneration {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        internal = internal == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(internal));
    }

    @Override
    public String toString() {
        return "CredentialGeneration[outputs=" + outputs.keySet() + ", internal=" + internal.keySet() + ", rotatedAt=" + rotatedAt + "]";
    }
}
