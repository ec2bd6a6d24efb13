package tech.yump.rotator.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import tech.yump.rotator.audit.AuditBackend;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.audit.LogAuditBackend;
import tech.yump.rotator.rotation.RetryPolicy;
import tech.yump.rotator.template.TemplateRegistry;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full application with the default audit backend.
 */
@SpringBootTest
@DisplayName("Integration Test: SLF4j Audit Backend (Default)")
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class Slf4jAuditBackendIntegrationTest {

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private AuditHelper auditHelper;
    @Autowired
    private TemplateRegistry templateRegistry;
    @Autowired
    private RetryPolicy retryPolicy;

    @Test
    void shouldUseSlf4jAuditBackendAndLogToConsole(CapturedOutput output) {
        assertThat(auditBackend)
                .withFailMessage("Expected LogAuditBackend bean as the default")
                .isInstanceOf(LogAuditBackend.class);

        String eventId = UUID.randomUUID().toString();
        auditHelper.logInternalEvent("test_slf4j", "log_event", "success", "logger", Map.of("id", eventId));

        assertThat(output.getOut())
                .contains("ROTATION_AUDIT [type=test_slf4j action=log_event outcome=success]")
                .contains("\"type\":\"test_slf4j\"")
                .contains(eventId);
    }

    @Test
    void shouldLoadBundledTemplatesAndTestRetryPolicy() {
        assertThat(templateRegistry.all())
                .extracting(template -> template.name())
                .containsExactly("mysql", "postgres", "sendgrid");
        assertThat(retryPolicy.maxAttempts()).isEqualTo(1);
    }
}
