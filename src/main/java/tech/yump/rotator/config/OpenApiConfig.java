package tech.yump.rotator.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.rotator.audit.AuditHelper;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        // Authentication is enforced in front of the service; callers only correlate requests.
        HeaderParameter requestId = new HeaderParameter();
        requestId.setName(AuditHelper.REQUEST_ID_HEADER);
        requestId.setRequired(false);
        requestId.setDescription("Optional correlation id, recorded in the audit log.");
        requestId.setSchema(new StringSchema());

        return new OpenAPI()
                .info(new Info()
                        .title("Lite Rotator API")
                        .description("Template-driven credential rotation for HTTP APIs and SQL databases.")
                        .version("v1")
                        .license(new License().name("Internal use")))
                .components(new Components()
                        .addParameters("RequestId", requestId));
    }
}
