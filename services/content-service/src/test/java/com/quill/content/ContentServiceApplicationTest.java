package com.quill.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.quill.content.config.ContentServiceProperties;
import com.quill.content.domain.UserStore;
import com.quill.content.infrastructure.jdbc.JdbcUserStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Integration tests for the content service application on the test profile (H2, fast BCrypt).
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Content Service Application")
class ContentServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("Service properties are loaded from test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(ContentServiceProperties.class);
        assertThat(props.name()).isEqualTo("quill-content-service-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("JDBC stores are the default")
    void jdbcStoresByDefault() {
        assertThat(context.getBean(UserStore.class)).isInstanceOf(JdbcUserStore.class);
    }

    @Test
    @DisplayName("Service info endpoint reports name and schema version")
    void serviceInfoEndpoint() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("quill-content-service-test"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.schemaVersion").value("2"))
                .andExpect(jsonPath("$.appliedMigrations").value(2))
                .andExpect(jsonPath("$.pendingMigrations").value(0));
    }

    @Test
    @DisplayName("Actuator health endpoint is available")
    void actuatorHealthEndpointIsAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("Unknown routes answer 404 in the error format")
    void unknownRoute() throws Exception {
        mockMvc.perform(get("/api/v1/nothing-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NotFound"));
    }

    @Test
    @DisplayName("Correlation ID header is set on responses")
    void correlationIdHeaderIsSetOnResponse() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(result -> assertThat(result.getResponse().getHeader("X-Correlation-ID"))
                        .isNotBlank());
    }
}
