package com.quill.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.quill.content.domain.PostStore;
import com.quill.content.domain.UserStore;
import com.quill.content.infrastructure.memory.InMemoryPostStore;
import com.quill.content.infrastructure.memory.InMemoryUserStore;
import com.quill.database.migration.MigrationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Runs the application with the in-memory stores and migrations switched off.
 */
@SpringBootTest(properties = {"quill.store.type=memory", "quill.flyway.enabled=false"})
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Content Service Application (in-memory store)")
class InMemoryStoreApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("wires the in-memory stores and no migration service")
    void wiresMemoryStores() {
        assertThat(context.getBean(UserStore.class)).isInstanceOf(InMemoryUserStore.class);
        assertThat(context.getBean(PostStore.class)).isInstanceOf(InMemoryPostStore.class);
        assertThat(context.getBeansOfType(MigrationService.class)).isEmpty();
    }

    @Test
    @DisplayName("reports no schema version")
    void noSchemaVersion() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schemaVersion").value("none"))
                .andExpect(jsonPath("$.pendingMigrations").doesNotExist());
    }

    @Test
    @DisplayName("registers a user against the in-memory store")
    void registers() throws Exception {
        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Carol\",\"email\":\"carol@example.com\",\"password\":\"Secret123\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.user.email").value("carol@example.com"));
    }
}
