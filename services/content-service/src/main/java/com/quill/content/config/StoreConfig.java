package com.quill.content.config;

import com.quill.content.domain.PostStore;
import com.quill.content.domain.UserStore;
import com.quill.content.infrastructure.jdbc.JdbcPostStore;
import com.quill.content.infrastructure.jdbc.JdbcUserStore;
import com.quill.content.infrastructure.memory.InMemoryPostStore;
import com.quill.content.infrastructure.memory.InMemoryUserStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Store wiring. {@link StoreProperties#type()} picks the engine for both stores.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public UserStore userStore(StoreProperties properties, JdbcTemplate jdbcTemplate, Clock clock) {
        log.info("User store: {}", properties.type());
        return switch (properties.type()) {
            case JDBC -> new JdbcUserStore(jdbcTemplate, clock);
            case MEMORY -> new InMemoryUserStore(clock);
        };
    }

    @Bean
    public PostStore postStore(StoreProperties properties, JdbcTemplate jdbcTemplate, Clock clock) {
        log.info("Post store: {}", properties.type());
        return switch (properties.type()) {
            case JDBC -> new JdbcPostStore(jdbcTemplate, clock);
            case MEMORY -> new InMemoryPostStore(clock);
        };
    }
}
