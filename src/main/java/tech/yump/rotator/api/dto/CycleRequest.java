package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.rotator.service.CredentialGeneration;

import java.util.List;
import java.util.Map;

@Schema(description = "Request to rotate a credential and maintain its generation history.")
public record CycleRequest(
        @Schema(description = "Input values, validated against the template's input schema.")
        Map<String, Object> inputs,

        @Schema(description = "Committed generations, newest first, as returned by the previous cycle.")
        List<CredentialGeneration> generations
) {
    public CycleRequest {
        inputs = inputs == null ? Map.of() : inputs;
        generations = generations == null ? List.of() : generations;
    }
}
