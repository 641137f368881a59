package com.parley.feedservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.parley.eventbus.GatePolicy;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FeedServiceProperties")
class FeedServicePropertiesTest {

    @Test
    @DisplayName("accepts explicit values")
    void acceptsExplicitValues() {
        var props = new FeedServiceProperties("feed", "production", 10, 40, 32, 2,
                Duration.ofSeconds(3), GatePolicy.DROP, Duration.ofMinutes(5), List.of("https://app.parley.dev"));

        assertThat(props.defaultPageSize()).isEqualTo(10);
        assertThat(props.maxPageSize()).isEqualTo(40);
        assertThat(props.authTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(props.gatePolicy()).isEqualTo(GatePolicy.DROP);
        assertThat(props.corsAllowedOrigins()).containsExactly("https://app.parley.dev");
    }

    @Test
    @DisplayName("applies defaults for omitted values")
    void appliesDefaults() {
        var props = new FeedServiceProperties("feed", null, 0, 0, 0, 0, null, null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.defaultPageSize()).isEqualTo(20);
        assertThat(props.maxPageSize()).isEqualTo(100);
        assertThat(props.channelBufferSize()).isEqualTo(256);
        assertThat(props.deliveryThreads()).isEqualTo(4);
        assertThat(props.authTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.gatePolicy()).isEqualTo(GatePolicy.BUFFER);
        assertThat(props.sseTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(props.corsAllowedOrigins()).isEmpty();
    }

    @Test
    @DisplayName("rejects a default page size above the maximum")
    void rejectsInconsistentPageSizes() {
        assertThatThrownBy(() -> new FeedServiceProperties("feed", null, 50, 10, 0, 0, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-page-size");
    }
}
