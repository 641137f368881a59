package com.parley.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "feed-test");
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
        @DisplayName("inMemory() creates a working factory")
        void inMemory() {
            var inMemory = MetricFactory.inMemory("svc");

            inMemory.counter("x", "x").increment();

            assertThat(inMemory.registry().get("x").counter().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("counter carries the service tag and extra tags")
    void counterTags() {
        Counter counter = factory.counter("feed.bus.published", "Published events", "topic", "MESSAGE_ADDED");

        counter.increment(3);

        assertThat(counter.count()).isEqualTo(3.0);
        assertThat(counter.getId().getTag("service")).isEqualTo("feed-test");
        assertThat(counter.getId().getTag("topic")).isEqualTo("MESSAGE_ADDED");
    }

    @Test
    @DisplayName("same name and tags return the same counter")
    void countersAreShared() {
        factory.counter("feed.bus.dropped", "Dropped").increment();
        factory.counter("feed.bus.dropped", "Dropped").increment();

        assertThat(registry.get("feed.bus.dropped").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timer() {
        Timer timer = factory.timer("feed.pagination.resolve", "Resolve latency");

        timer.record(Duration.ofMillis(15));

        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("gauge samples its supplier")
    void gauge() {
        var active = new AtomicInteger(4);
        factory.gauge("feed.subscriptions.active", "Active subscriptions", active::get);

        active.set(9);

        assertThat(registry.get("feed.subscriptions.active").gauge().value()).isEqualTo(9.0);
    }
}
