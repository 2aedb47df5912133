package com.quill.database.migration;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Read-only view of a database's migration state.
 *
 * <p>A POJO over a {@link Flyway} instance: usable from an info endpoint, a health check or a
 * plain unit test without a Spring context. Every call asks Flyway afresh, so the answer reflects
 * the schema history table at the time of the call.
 */
public class MigrationService {

    /**
     * Overall migration status of a database.
     *
     * @param database          database name (e.g. "quill")
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion    current schema version (null if no migrations applied)
     */
    public record DatabaseStatus(
            String database,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion) {}

    private final String database;
    private final Flyway flyway;

    /**
     * @param database name reported in every status record
     * @param flyway   the configured Flyway instance for that database
     */
    public MigrationService(String database, Flyway flyway) {
        if (database == null || database.isBlank() || flyway == null) {
            throw new IllegalArgumentException("database and flyway must be provided");
        }
        this.database = database;
        this.flyway = flyway;
    }

    /**
     * Returns the current migration status.
     */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        String currentVersion =
                current == null || current.getVersion() == null
                        ? null
                        : current.getVersion().getVersion();
        return new DatabaseStatus(
                database, info.applied().length, info.pending().length, currentVersion);
    }
}
