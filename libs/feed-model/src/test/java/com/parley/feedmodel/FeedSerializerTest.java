package com.parley.feedmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FeedSerializer")
class FeedSerializerTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:15:30.123Z");

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("message JSON carries every field")
        void messageFields() {
            var json = FeedSerializer.serialize(new Message(42, 7, 3, "hello", CREATED));

            assertThat(json)
                    .contains("\"id\":42")
                    .contains("\"groupId\":7")
                    .contains("\"authorId\":3")
                    .contains("\"text\":\"hello\"");
        }

        @Test
        @DisplayName("serializes Instant as ISO 8601 string (not numeric timestamp)")
        void instantAsIso8601() {
            var json = FeedSerializer.serialize(new Message(1, 1, 1, "x", CREATED));

            assertThat(json).contains("\"createdAt\":\"2024-03-01T10:15:30.123Z\"");
        }

        @Test
        @DisplayName("group JSON lists members")
        void groupMembers() {
            var json = FeedSerializer.serialize(new Group(5, "crew", 1, Set.of(1L), CREATED));

            assertThat(json).contains("\"memberIds\":[1]").contains("\"name\":\"crew\"");
        }
    }

    @Nested
    @DisplayName("deserialize()")
    class Deserialize {

        @Test
        @DisplayName("reads a message back from JSON")
        void readsMessage() {
            var original = new Message(9, 2, 4, "hi there", CREATED);

            var parsed = FeedSerializer.deserialize(FeedSerializer.serialize(original), Message.class);

            assertThat(parsed).isEqualTo(original);
        }

        @Test
        @DisplayName("throws FeedSerializationException on malformed JSON")
        void malformed() {
            assertThatThrownBy(() -> FeedSerializer.deserialize("{not json", Message.class))
                    .isInstanceOf(FeedSerializer.FeedSerializationException.class)
                    .hasMessageContaining("Message");
        }

        @Test
        @DisplayName("tryDeserialize returns empty on malformed JSON")
        void tryDeserializeEmpty() {
            assertThat(FeedSerializer.tryDeserialize("[]", Message.class)).isEmpty();
        }
    }
}
