package tech.yump.rotator.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotator.template.TemplateRegistry;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

  private final TemplateRegistry templateRegistry;

  public RootController(TemplateRegistry templateRegistry) {
    this.templateRegistry = templateRegistry;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Provides a simple welcome message, status check and the number of loaded templates."
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Welcome to LiteRotator API\", \"status\": \"OK\", \"templates\": 3}")))
  public Map<String, Object> getRoot() {
    return Map.of("message", "Welcome to LiteRotator API", "status", "OK", "templates", templateRegistry.all().size());
  }
}
