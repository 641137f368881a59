package com.parley.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CursorCodec")
class CursorCodecTest {

    @Nested
    @DisplayName("encode()")
    class Encode {

        @Test
        @DisplayName("produces Base64 of the decimal id")
        void base64OfDecimal() {
            assertThat(CursorCodec.encode(42)).isEqualTo("NDI=");
        }

        @Test
        @DisplayName("distinct ids give distinct cursors")
        void injective() {
            assertThat(CursorCodec.encode(12)).isNotEqualTo(CursorCodec.encode(21));
            assertThat(CursorCodec.encode(1)).isNotEqualTo(CursorCodec.encode(10));
        }

        @Test
        @DisplayName("rejects non-positive ids")
        void rejectsNonPositive() {
            assertThatThrownBy(() -> CursorCodec.encode(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("decode()")
    class Decode {

        @ParameterizedTest
        @ValueSource(longs = {1, 7, 10, 999, 1_000_000_007L, Long.MAX_VALUE})
        @DisplayName("returns the id a cursor was issued for")
        void returnsOriginalId(long id) {
            assertThat(CursorCodec.decode(CursorCodec.encode(id))).isEqualTo(id);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "not base64!", "%%%"})
        @DisplayName("rejects blank or non-Base64 input")
        void rejectsMalformed(String cursor) {
            assertThatThrownBy(() -> CursorCodec.decode(cursor)).isInstanceOf(InvalidCursorException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "-5", "0", "12a", "99999999999999999999"})
        @DisplayName("rejects payloads that are not a positive decimal id")
        void rejectsNonNumeric(String payload) {
            String cursor = base64(payload);

            assertThatThrownBy(() -> CursorCodec.decode(cursor))
                    .isInstanceOf(InvalidCursorException.class)
                    .satisfies(e -> assertThat(((InvalidCursorException) e).cursor()).isEqualTo(cursor));
        }

        @Test
        @DisplayName("rejects non-canonical encodings of a valid id")
        void rejectsNonCanonical() {
            assertThatThrownBy(() -> CursorCodec.decode(base64("007")))
                    .isInstanceOf(InvalidCursorException.class)
                    .hasMessageContaining("canonical");
            assertThatThrownBy(() -> CursorCodec.decode("NDI"))
                    .isInstanceOf(InvalidCursorException.class);
        }

        private String base64(String s) {
            return Base64.getEncoder().encodeToString(s.getBytes(StandardCharsets.US_ASCII));
        }
    }
}
