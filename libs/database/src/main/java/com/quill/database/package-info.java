/**
 * Schema management for the Quill platform.
 *
 * <p>Flyway owns the schema. Versioned scripts live under {@code classpath:db/migration/quill} in
 * this module's resources and are applied against the application's {@link javax.sql.DataSource}
 * at startup, before any store is used.
 *
 * @see com.quill.database.migration.FlywayMigrationConfig
 * @see com.quill.database.migration.FlywayConfigProperties
 */
package com.quill.database;
