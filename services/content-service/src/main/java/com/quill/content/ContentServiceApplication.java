package com.quill.content;

import com.quill.content.config.AuthProperties;
import com.quill.content.config.ContentServiceProperties;
import com.quill.content.config.StoreProperties;
import com.quill.database.migration.FlywayMigrationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Quill content service: accounts, bearer-token authentication and owner-enforced posts.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation and the auth gate as servlet filters
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Flyway migrations from {@code quill-database}, in place of Spring Boot's own Flyway setup
 * </ul>
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties({
    ContentServiceProperties.class,
    AuthProperties.class,
    StoreProperties.class
})
@Import(FlywayMigrationConfig.class)
public class ContentServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ContentServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ContentServiceApplication.class, args);
        log.info("Quill content service started");
    }
}
