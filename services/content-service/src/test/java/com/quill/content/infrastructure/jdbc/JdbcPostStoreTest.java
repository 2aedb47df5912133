package com.quill.content.infrastructure.jdbc;

import com.quill.content.domain.PostStore;
import com.quill.content.domain.UserStore;
import com.quill.content.infrastructure.AbstractPostStoreTest;
import com.quill.security.testing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcPostStore (H2)")
class JdbcPostStoreTest extends AbstractPostStoreTest {

    private JdbcTemplate jdbc;

    @Override
    protected UserStore createUserStore(MutableClock clock) {
        jdbc = H2Databases.migrated();
        return new JdbcUserStore(jdbc, clock);
    }

    @Override
    protected PostStore createPostStore(MutableClock clock) {
        return new JdbcPostStore(jdbc, clock);
    }
}
