package tech.yump.rotator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the rotation engine under the 'rotator' prefix.
 * Every section is optional; missing sections fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "rotator")
@Validated
public record RotatorProperties(

        @Valid
        TemplateProperties templates,

        @Valid
        HttpProperties http,

        @Valid
        DbProperties db,

        @Valid
        RetryProperties retry,

        @Valid
        AuditProperties audit
) {

    public RotatorProperties {
        if (templates == null) {
            templates = new TemplateProperties(null);
        }
        if (http == null) {
            http = new HttpProperties(null, null);
        }
        if (db == null) {
            db = new DbProperties(null, null);
        }
        if (retry == null) {
            retry = new RetryProperties(null, null, null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null);
        }
    }

    /**
     * Properties with every section at its default value.
     */
    public static RotatorProperties defaults() {
        return new RotatorProperties(null, null, null, null, null);
    }

    // --- TemplateProperties ---
    @Validated
    public record TemplateProperties(
            @NotEmpty(message = "At least one template location (rotator.templates.locations) must be provided.")
            List<String> locations
    ) {
        public static final String DEFAULT_LOCATION = "classpath*:templates/*.json";

        public TemplateProperties {
            if (locations == null) {
                locations = List.of(DEFAULT_LOCATION);
            }
        }
    }

    // --- HttpProperties ---
    @Validated
    public record HttpProperties(
            @NotNull(message = "HTTP connect timeout (rotator.http.connect-timeout) is required.")
            Duration connectTimeout,

            @NotNull(message = "HTTP read timeout (rotator.http.read-timeout) is required.")
            Duration readTimeout
    ) {
        public HttpProperties {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(15);
            }
        }

        @AssertTrue(message = "HTTP timeouts (rotator.http.*) must be positive.")
        private boolean isTimeoutsPositive() {
            return !connectTimeout.isNegative() && !connectTimeout.isZero()
                    && !readTimeout.isNegative() && !readTimeout.isZero();
        }
    }

    // --- DbProperties ---
    @Validated
    public record DbProperties(
            @NotNull(message = "Database connect timeout (rotator.db.connect-timeout) is required.")
            Duration connectTimeout,

            @NotNull(message = "Database query timeout (rotator.db.query-timeout) is required.")
            Duration queryTimeout
    ) {
        public DbProperties {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(10);
            }
            if (queryTimeout == null) {
                queryTimeout = Duration.ofSeconds(15);
            }
        }

        @AssertTrue(message = "Database timeouts (rotator.db.*) must be at least one second.")
        private boolean isTimeoutsValid() {
            return connectTimeout.toSeconds() >= 1 && queryTimeout.toSeconds() >= 1;
        }
    }

    /**
     * Retry policy applied around the executor call of a rotation cycle.
     * {@code maxAttempts} counts the first attempt.
     */
    @Validated
    public record RetryProperties(
            @Min(value = 1, message = "Retry max attempts (rotator.retry.max-attempts) must be at least 1.")
            @Max(value = 10, message = "Retry max attempts (rotator.retry.max-attempts) must not exceed 10.")
            Integer maxAttempts,

            @NotNull
            Duration initialDelay,

            @NotNull
            Duration maxDelay,

            @DecimalMin(value = "1.0", message = "Retry multiplier (rotator.retry.multiplier) must be >= 1.0.")
            Double multiplier
    ) {
        public RetryProperties {
            if (maxAttempts == null) {
                maxAttempts = 2;
            }
            if (initialDelay == null) {
                initialDelay = Duration.ofMillis(500);
            }
            if (maxDelay == null) {
                maxDelay = Duration.ofSeconds(5);
            }
            if (multiplier == null) {
                multiplier = 2.0;
            }
        }

        @AssertTrue(message = "Retry max delay (rotator.retry.max-delay) must be >= initial delay.")
        private boolean isDelayRangeValid() {
            return maxDelay.compareTo(initialDelay) >= 0;
        }
    }

    // --- AuditProperties ---
    @Validated
    public record AuditProperties(
            @NotBlank
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            if (backend == null) {
                backend = "slf4j";
            }
        }

        @AssertTrue(message = "Audit backend (rotator.audit.backend) must be 'slf4j' or 'file'.")
        private boolean isBackendKnown() {
            return "slf4j".equals(backend) || "file".equals(backend);
        }

        @AssertTrue(message = "File audit path (rotator.audit.file.path) must be provided when the file backend is selected.")
        private boolean isFileConfigValid() {
            return !"file".equals(backend) || (file != null && file.path() != null && !file.path().isBlank());
        }

        @Validated
        public record FileAuditProperties(
                String path
        ) {
            public static final String PATH_PROPERTY = "rotator.audit.file.path";
        }
    }
}
