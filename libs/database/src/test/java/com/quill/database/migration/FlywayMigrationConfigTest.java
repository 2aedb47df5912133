package com.quill.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Wires {@link FlywayMigrationConfig} in a minimal context over an in-memory H2 database.
 */
@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner()
                    .withBean(DataSource.class, FlywayMigrationConfigTest::h2)
                    .withUserConfiguration(FlywayMigrationConfig.class);

    @Test
    @DisplayName("migrates the schema when the context starts")
    void migratesOnStartup() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasBean(FlywayMigrationConfig.QUILL_FLYWAY_BEAN);

            var jdbc = new JdbcTemplate(context.getBean(DataSource.class));
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM users", Integer.class)).isZero();
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM posts", Integer.class)).isZero();

            var status = context.getBean(MigrationService.class).status();
            assertThat(status.database()).isEqualTo(FlywayMigrationConfig.QUILL_DATABASE);
            assertThat(status.pendingMigrations()).isZero();
        });
    }

    @Test
    @DisplayName("creates no Flyway bean when disabled")
    void disabled() {
        runner.withPropertyValues("quill.flyway.enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(Flyway.class);
                    assertThat(context).doesNotHaveBean(MigrationService.class);
                });
    }

    @Test
    @DisplayName("fails startup when the configured locations hold a broken script")
    void brokenScriptFailsStartup() {
        runner.withPropertyValues("quill.flyway.locations=classpath:db/broken")
                .run(context -> assertThat(context).hasFailed());
    }

    private static DataSource h2() {
        return new DriverManagerDataSource(
                "jdbc:h2:mem:flyway-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
    }
}
