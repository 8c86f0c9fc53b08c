package io.stagewise.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.state.PipelineState;

/// Serializes pipeline state and checkpoints to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = StateSerializer.toJson(checkpoint);
/// Checkpoint restored = StateSerializer.checkpointFromJson(json);
/// }
///
/// @implNote Thread-safe. The shared mapper is configured once and never mutated.
///
/// @see StagewiseJacksonModule for the registered type handlers
public final class StateSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private StateSerializer() {}

    /// Serializes a checkpoint.
    ///
    /// @param checkpoint the checkpoint, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Checkpoint checkpoint) {
        try {
            return MAPPER.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize checkpoint: " + e.getMessage(), e);
        }
    }

    /// Deserializes a checkpoint.
    ///
    /// @param json JSON text, not null
    /// @return the checkpoint, never null
    /// @throws IllegalArgumentException if the text is not a valid checkpoint
    public static Checkpoint checkpointFromJson(String json) {
        try {
            return MAPPER.readValue(json, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize checkpoint: " + e.getMessage(), e);
        }
    }

    public static String toJson(PipelineState state) {
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize state: " + e.getMessage(), e);
        }
    }

    public static PipelineState stateFromJson(String json) {
        try {
            return MAPPER.readValue(json, PipelineState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize state: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for stagewise types.
    ///
    /// Registers:
    /// - `StagewiseJacksonModule` for artifacts and tables
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StagewiseJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
