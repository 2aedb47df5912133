/**
 * Flyway migration configuration and status.
 *
 * <ul>
 *   <li>{@link com.quill.database.migration.FlywayConfigProperties}: {@code quill.flyway.*}
 *       settings
 *   <li>{@link com.quill.database.migration.FlywayMigrationConfig}: the {@code quillFlyway} bean,
 *       migrated on creation
 *   <li>{@link com.quill.database.migration.MigrationService}: applied/pending migrations and the
 *       current schema version
 * </ul>
 */
package com.quill.database.migration;
