package com.quill.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway setup for the Quill schema.
 *
 * <p>Runs against the application's own {@link DataSource} rather than a separate connection, so
 * the stores and the migrations always see the same database. The bean is migrated as part of its
 * initialisation; a failed migration aborts startup.
 *
 * <p>Services import this class and switch off Spring Boot's Flyway auto-configuration:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(
        prefix = "quill.flyway",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class FlywayMigrationConfig {

    /** Bean name of the Quill Flyway instance. */
    public static final String QUILL_FLYWAY_BEAN = "quillFlyway";

    /** Database name reported by {@link MigrationService}. */
    public static final String QUILL_DATABASE = "quill";

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /**
     * Creates the Flyway instance; {@code migrate} runs when the bean is initialised.
     *
     * @param dataSource the application data source
     * @param properties externalized Flyway configuration
     * @return configured Flyway instance
     */
    @Bean(name = QUILL_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway quillFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        log.info("Configuring Flyway: locations={}, baselineOnMigrate={}",
                properties.locations(), properties.baselineOnMigrate());
        return createFlyway(dataSource, properties);
    }

    @Bean
    public MigrationService migrationService(@Qualifier(QUILL_FLYWAY_BEAN) Flyway flyway) {
        return new MigrationService(QUILL_DATABASE, flyway);
    }

    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
