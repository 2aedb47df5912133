package com.quill.content.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the configuration records bound under {@code quill.service} and
 * {@code quill.store}.
 */
@DisplayName("ContentServiceProperties")
class ContentServicePropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    @DisplayName("creates with all fields")
    void createsWithAllFields() {
        var props = new ContentServiceProperties("quill-content-service", "production", "Accounts and posts");

        assertThat(props.name()).isEqualTo("quill-content-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.description()).isEqualTo("Accounts and posts");
    }

    @Test
    @DisplayName("defaults environment to development and description to empty")
    void appliesDefaults() {
        var props = new ContentServiceProperties("svc", null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.description()).isEmpty();
    }

    @Test
    @DisplayName("blank environment falls back to development")
    void blankEnvironment() {
        assertThat(new ContentServiceProperties("svc", "  ", "").environment()).isEqualTo("development");
    }

    @Test
    @DisplayName("name is required")
    void nameRequired() {
        assertThat(validator.validate(new ContentServiceProperties("", null, null))).hasSize(1);
        assertThat(validator.validate(new ContentServiceProperties("svc", null, null))).isEmpty();
    }

    @Test
    @DisplayName("store type defaults to jdbc")
    void storeDefault() {
        assertThat(new StoreProperties(null).type()).isEqualTo(StoreProperties.StoreType.JDBC);
        assertThat(new StoreProperties(StoreProperties.StoreType.MEMORY).type())
                .isEqualTo(StoreProperties.StoreType.MEMORY);
    }
}
