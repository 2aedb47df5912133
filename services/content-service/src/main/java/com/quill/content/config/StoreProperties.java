package com.quill.content.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Persistence engine selection, bound from {@code quill.store.*}.
 *
 * @param type {@code jdbc} (default) or {@code memory}
 */
@ConfigurationProperties(prefix = "quill.store")
public record StoreProperties(StoreType type) {

    public enum StoreType {
        JDBC,
        MEMORY
    }

    public StoreProperties {
        if (type == null) {
            type = StoreType.JDBC;
        }
    }
}
