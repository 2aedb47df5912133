package com.quill.content.config;

import com.quill.observability.MetricFactory;
import com.quill.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metric factory tagged with the service name, and the redactor used for audit log fields.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ContentServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
