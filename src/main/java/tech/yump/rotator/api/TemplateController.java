package tech.yump.rotator.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotator.api.dto.TemplateSummary;
import tech.yump.rotator.template.TemplateRegistry;

import java.util.List;

@RestController
@RequestMapping("/v1/templates")
@RequiredArgsConstructor
@Tag(name = "Templates", description = "Catalog of provider templates")
public class TemplateController {

    private final TemplateRegistry templateRegistry;

    @GetMapping
    @Operation(summary = "List provider templates")
    @ApiResponse(responseCode = "200", description = "Catalog entries.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, array = @ArraySchema(schema = @Schema(implementation = TemplateSummary.class))))
    public List<TemplateSummary> listTemplates() {
        return templateRegistry.all().stream().map(TemplateSummary::from).toList();
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get one provider template")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Catalog entry.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = TemplateSummary.class))),
            @ApiResponse(responseCode = "404", description = "Template not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public TemplateSummary getTemplate(
            @Parameter(description = "Template name.", required = true, example = "postgres")
            @PathVariable String name) {
        return TemplateSummary.from(templateRegistry.get(name));
    }
}
