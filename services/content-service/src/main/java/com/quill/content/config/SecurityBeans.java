package com.quill.content.config;

import com.quill.security.PasswordHasher;
import com.quill.security.TokenService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Token service, password hasher and the clock they share with the stores.
 */
@Configuration
public class SecurityBeans {

    private static final Logger log = LoggerFactory.getLogger(SecurityBeans.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenService tokenService(AuthProperties properties, Clock clock) {
        log.info("Token service configured: ttl={}, clockSkew={}",
                properties.tokenTtl(), properties.clockSkew());
        return new TokenService(properties.toTokenSettings(), clock);
    }

    @Bean
    public PasswordHasher passwordHasher(AuthProperties properties) {
        return new PasswordHasher(properties.bcryptStrength());
    }
}
