package io.stagewise.core.llm;

import io.stagewise.core.state.ChatMessage;
import java.util.List;

/// Text-generation service: a conversation in, free text or a schema-conforming value out.
///
/// Implementations wrap a concrete model provider; see the langchain4j adapter module.
///
/// @see FallbackTextGenerator
/// @see OutputSchema
public interface TextGenerator {

    /// Returns an identifier of the model behind this generator, used in logs.
    ///
    /// @return model id, not null
    String id();

    /// Generates free text.
    ///
    /// @param conversation ordered conversation, not null or empty
    /// @return generated text, never null
    /// @throws GenerationException if the provider call fails
    String generate(List<ChatMessage> conversation);

    /// Generates a value conforming to a schema.
    ///
    /// @param conversation ordered conversation, not null or empty
    /// @param schema expected output structure, not null
    /// @param <T> bound result type
    /// @return the bound value, never null
    /// @throws GenerationException if the call fails or the output does not fit the schema
    <T> T generate(List<ChatMessage> conversation, OutputSchema<T> schema);
}
