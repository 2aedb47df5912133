package com.quill.content.api;

import com.quill.content.config.ContentServiceProperties;
import com.quill.database.migration.MigrationService;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime information: service identity and the migration state Flyway reports.
 *
 * <p>{@code schemaVersion} is {@code "none"} and the migration counts are omitted when migrations
 * are switched off (in-memory store).
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ContentServiceProperties properties;
    private final ObjectProvider<MigrationService> migrations;

    public ServiceInfoController(
            ContentServiceProperties properties, ObjectProvider<MigrationService> migrations) {
        this.properties = properties;
        this.migrations = migrations;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        MigrationService migrationService = migrations.getIfAvailable();
        MigrationService.DatabaseStatus schema =
                migrationService == null ? null : migrationService.status();

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description());
        if (schema == null) {
            info.put("schemaVersion", "none");
        } else {
            String version = schema.currentVersion();
            info.put("schemaVersion", version != null ? version : "none");
            info.put("appliedMigrations", schema.appliedMigrations());
            info.put("pendingMigrations", schema.pendingMigrations());
        }
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        return info;
    }
}
