package com.quill.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the Quill schema.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * quill:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/quill
 *     baseline-on-migrate: false
 * }</pre>
 *
 * <p>Spring Boot's own {@code spring.flyway} auto-configuration must be disabled in services that
 * use this module, otherwise the schema is migrated twice.
 *
 * @param enabled           whether migrations run at startup (default true)
 * @param locations         Flyway script locations (default {@value #DEFAULT_LOCATIONS})
 * @param baselineOnMigrate baseline a non-empty schema that has no history table (default false)
 */
@Validated
@ConfigurationProperties(prefix = "quill.flyway")
public record FlywayConfigProperties(
        Boolean enabled, @NotBlank String locations, Boolean baselineOnMigrate) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/quill";

    public FlywayConfigProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null) {
            locations = DEFAULT_LOCATIONS;
        }
        if (baselineOnMigrate == null) {
            baselineOnMigrate = Boolean.FALSE;
        }
    }

    /** Defaults for every setting. */
    public static FlywayConfigProperties defaults() {
        return new FlywayConfigProperties(null, null, null);
    }
}
