package com.parley.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdBound")
class IdBoundTest {

    @Test
    @DisplayName("atMost includes the pivot")
    void atMostIsInclusive() {
        IdBound bound = IdBound.atMost(10);

        assertThat(bound.accepts(10)).isTrue();
        assertThat(bound.accepts(9)).isTrue();
        assertThat(bound.accepts(11)).isFalse();
    }

    @Test
    @DisplayName("atLeast includes the pivot")
    void atLeastIsInclusive() {
        IdBound bound = IdBound.atLeast(10);

        assertThat(bound.accepts(10)).isTrue();
        assertThat(bound.accepts(11)).isTrue();
        assertThat(bound.accepts(9)).isFalse();
    }

    @Test
    @DisplayName("inclusive bounds at the ends of the id range accept everything instead of wrapping")
    void saturatesAtRangeEnds() {
        assertThat(IdBound.atMost(Long.MAX_VALUE)).isEqualTo(IdBound.none());
        assertThat(IdBound.atLeast(Long.MIN_VALUE)).isEqualTo(IdBound.none());
        assertThat(IdBound.atMost(Long.MAX_VALUE).accepts(5)).isTrue();
    }
}
