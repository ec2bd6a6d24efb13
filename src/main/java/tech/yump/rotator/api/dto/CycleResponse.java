package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.rotator.service.CredentialGeneration;
import tech.yump.rotator.service.RetirementStatus;
import tech.yump.rotator.service.RotationCycleOutcome;

import java.util.List;

@Schema(description = "Generation history after a successful rotation.")
public record CycleResponse(
        @Schema(description = "Committed generations, newest first.", requiredMode = Schema.RequiredMode.REQUIRED)
        List<CredentialGeneration> generations,

        @Schema(description = "What happened to the generation pushed out of the history.", example = "REMOVED",
                requiredMode = Schema.RequiredMode.REQUIRED)
        RetirementStatus retirement,

        @Schema(description = "Reason the retirement failed, if it did.")
        String retirementError
) {
    public static CycleResponse from(RotationCycleOutcome outcome) {
        return new CycleResponse(outcome.generations(), outcome.retirement(), outcome.retirementError());
    }
}
