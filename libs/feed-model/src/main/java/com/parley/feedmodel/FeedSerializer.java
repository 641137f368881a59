package com.parley.feedmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON serialization for feed records pushed to subscribers.
 * <p>
 * The {@code JavaTimeModule} renders {@code Instant} fields as ISO 8601 strings.
 */
public final class FeedSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private FeedSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes a feed record (message, group, or any Jackson-serializable value) to JSON.
     *
     * @throws FeedSerializationException if serialization fails
     */
    public static String serialize(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FeedSerializationException(
                    "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Deserializes JSON to the given record type.
     *
     * @throws FeedSerializationException if the JSON is malformed or does not match the type
     */
    public static <T> T deserialize(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new FeedSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static <T> Optional<T> tryDeserialize(String json, Class<T> type) {
        try {
            return Optional.of(deserialize(json, type));
        } catch (FeedSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when feed record serialization/deserialization fails.
     */
    public static class FeedSerializationException extends RuntimeException {
        public FeedSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
