package com.quill.content.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code quill.service.*}.
 *
 * <pre>
 * quill:
 *   service:
 *     name: quill-content-service
 *     environment: production
 *     description: Accounts and posts API
 * </pre>
 *
 * @param name        service name used for logging and the {@code service} metric tag. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description for {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "quill.service")
@Validated
public record ContentServiceProperties(
        @NotBlank String name, String environment, String description) {

    /**
     * Compact constructor: applies defaults before Bean Validation runs.
     */
    public ContentServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
