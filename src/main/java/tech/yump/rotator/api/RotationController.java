package tech.yump.rotator.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotator.api.dto.CycleRequest;
import tech.yump.rotator.api.dto.CycleResponse;
import tech.yump.rotator.api.dto.RotationRequest;
import tech.yump.rotator.api.dto.RotationResponse;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.rotation.RotationResult;
import tech.yump.rotator.service.RotationCycleOutcome;
import tech.yump.rotator.service.RotationService;
import tech.yump.rotator.template.OperationName;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1/rotations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Rotations", description = "Run provider template operations and full rotation cycles")
public class RotationController {

    static final String AUDIT_TYPE = "rotation_api";

    private final RotationService rotationService;
    private final AuditHelper auditHelper;

    @PostMapping(value = "/{templateName}/cycle", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Rotate a credential",
            description = "Runs 'set' (and 'test' when the template has one), makes the new credential the current generation, "
                    + "and retires generations beyond the previous one through 'remove' when the template defines it."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Rotation committed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = CycleResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid inputs.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Template not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "A rotation of this credential is already running.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "422", description = "A template token could not be resolved.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "The remote system call, extraction or verification failed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<CycleResponse> rotate(
            @Parameter(description = "Name of the provider template.", required = true, example = "sendgrid")
            @PathVariable String templateName,
            @RequestBody CycleRequest request
    ) {
        log.info("Controller: Received rotation cycle request for template: {}", templateName);
        RotationCycleOutcome outcome = rotationService.rotate(templateName, request.inputs(), request.generations());

        Map<String, Object> data = new HashMap<>();
        data.put("template", templateName);
        data.put("generations", outcome.generations().size());
        data.put("retirement", outcome.retirement().name());
        auditHelper.logHttpEvent(AUDIT_TYPE, "cycle", "success", HttpStatus.OK.value(), null, data);
        return ResponseEntity.ok(CycleResponse.from(outcome));
    }

    @PostMapping(value = "/{templateName}/{operation}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Run one template operation",
            description = "Runs 'set', 'test' or 'remove' with the given inputs and prior internal state, and returns the committed outputs and internal state."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Operation committed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RotationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid inputs or unknown operation.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Template not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "A rotation of this credential is already running.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "422", description = "A template token could not be resolved.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "The remote system call, extraction or verification failed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RotationResponse> runOperation(
            @Parameter(description = "Name of the provider template.", required = true, example = "postgres")
            @PathVariable String templateName,
            @Parameter(description = "Operation to run.", required = true, example = "set")
            @PathVariable String operation,
            @RequestBody RotationRequest request
    ) {
        OperationName operationName = OperationName.fromValue(operation);
        log.info("Controller: Received '{}' request for template: {}", operationName.value(), templateName);
        RotationResult result = rotationService.runOperation(templateName, operationName, request.inputs(), request.internal());

        auditHelper.logHttpEvent(AUDIT_TYPE, operationName.value(), "success", HttpStatus.OK.value(), null,
                Map.of("template", templateName));
        return ResponseEntity.ok(RotationResponse.from(result));
    }
}
