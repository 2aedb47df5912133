package com.quill.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Checks that the migration scripts are packaged where Flyway looks for them.
 */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    @Test
    @DisplayName("V1__create_users.sql defines users with a unique email")
    void usersScript() throws IOException {
        String sql = readClasspathResource("db/migration/quill/V1__create_users.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE users");
        assertThat(sql).containsIgnoringCase("UNIQUE (email)");
    }

    @Test
    @DisplayName("V2__create_posts.sql references the owning user")
    void postsScript() throws IOException {
        String sql = readClasspathResource("db/migration/quill/V2__create_posts.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE posts");
        assertThat(sql).containsIgnoringCase("REFERENCES users (id)");
        assertThat(sql).containsIgnoringCase("CREATE INDEX idx_posts_owner_id");
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
