package com.quill.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: service tagging, outcome counters and timers.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "content-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }

        @Test
        @DisplayName("should expose registry and service name")
        void shouldExposeRegistryAndServiceName() {
            assertThat(factory.registry()).isSameAs(registry);
            assertThat(factory.serviceName()).isEqualTo("content-service");
        }
    }

    @Nested
    @DisplayName("Counter")
    class CounterTests {

        @Test
        @DisplayName("should create counter with service tag and extra tags")
        void shouldCreateCounterWithTags() {
            Counter counter = factory.counter("quill.auth.gate.rejections", "Rejected requests",
                    "reason", "expired");

            counter.increment();

            assertThat(counter.count()).isEqualTo(1.0);
            assertThat(counter.getId().getTag("service")).isEqualTo("content-service");
            assertThat(counter.getId().getTag("reason")).isEqualTo("expired");
        }

        @Test
        @DisplayName("should return the same counter for the same name and tags")
        void shouldReuseCounter() {
            factory.counter("quill.posts.writes", "Writes").increment();
            factory.counter("quill.posts.writes", "Writes").increment();

            assertThat(registry.get("quill.posts.writes").counter().count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("recordOutcome")
    class RecordOutcome {

        @Test
        @DisplayName("should count each operation/outcome pair separately")
        void shouldCountPairsSeparately() {
            factory.recordOutcome("quill.auth.attempts", "Auth attempts", "login", "success");
            factory.recordOutcome("quill.auth.attempts", "Auth attempts", "login", "success");
            factory.recordOutcome("quill.auth.attempts", "Auth attempts", "login", "unauthenticated");

            assertThat(registry.get("quill.auth.attempts")
                    .tag("operation", "login").tag("outcome", "success")
                    .counter().count()).isEqualTo(2.0);
            assertThat(registry.get("quill.auth.attempts")
                    .tag("outcome", "unauthenticated")
                    .counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Timer")
    class TimerTests {

        @Test
        @DisplayName("should create timer with service tag")
        void shouldCreateTimerWithServiceTag() {
            Timer timer = factory.timer("quill.auth.hash.duration", "Hashing time");

            timer.record(Duration.ofMillis(150));
            timer.record(Duration.ofMillis(250));

            assertThat(timer.count()).isEqualTo(2);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
            assertThat(timer.getId().getTag("service")).isEqualTo("content-service");
        }
    }
}
