package io.stagewise.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.stagewise.core.llm.GenerationException;
import io.stagewise.core.llm.OutputSchema;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.util.JsonText;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link TextGenerator} backed by a LangChain4j {@link ChatModel}.
///
/// Structured output uses the provider's JSON-schema response format where the provider
/// supports it; otherwise the schema is appended as an instruction and the first JSON object
/// in the reply is parsed.
///
/// Provider failures surface as {@link GenerationException} carrying the HTTP status when one
/// is known, so the retry classifier can tell rate limits and outages from bad requests.
///
/// @implNote Stateless and thread-safe when the wrapped model is.
///
/// @see LangChain4jModelFactory for model creation
public class LangChain4jTextGenerator implements TextGenerator {

    private static final Logger logger = Logger.getLogger(LangChain4jTextGenerator.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    static final String JSON_INSTRUCTION =
            "Reply with a single JSON object that conforms to this JSON schema, with no other text:\n";

    private final String id;
    private final ChatModel model;
    private final boolean nativeJsonSchema;

    /// Creates a generator.
    ///
    /// @param id model identifier used in logs, not null
    /// @param model the chat model, not null
    /// @param nativeJsonSchema whether the provider accepts a JSON-schema response format
    public LangChain4jTextGenerator(String id, ChatModel model, boolean nativeJsonSchema) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.nativeJsonSchema = nativeJsonSchema;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String generate(List<ChatMessage> conversation) {
        ChatRequest request = ChatRequest.builder().messages(toMessages(conversation)).build();
        return chat(request);
    }

    @Override
    public <T> T generate(List<ChatMessage> conversation, OutputSchema<T> schema) {
        List<dev.langchain4j.data.message.ChatMessage> messages = toMessages(conversation);
        ChatRequest.Builder request = ChatRequest.builder();
        if (nativeJsonSchema) {
            request.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(JsonSchemas.of(schema))
                    .build());
        } else {
            messages.add(UserMessage.from(JSON_INSTRUCTION + JsonText.writePretty(schema.toJsonSchema())));
        }
        String text = chat(request.messages(messages).build());
        return schema.bind(parseObject(text, schema.name()));
    }

    static List<dev.langchain4j.data.message.ChatMessage> toMessages(List<ChatMessage> conversation) {
        if (conversation.isEmpty()) {
            throw new IllegalArgumentException("conversation must not be empty");
        }
        List<dev.langchain4j.data.message.ChatMessage> messages = new ArrayList<>(conversation.size() + 1);
        for (ChatMessage message : conversation) {
            messages.add(switch (message.role()) {
                case SYSTEM -> SystemMessage.from(message.content());
                case USER -> UserMessage.from(message.content());
                case ASSISTANT -> AiMessage.from(message.content());
            });
        }
        return messages;
    }

    /// Parses the first JSON object found in a reply, tolerating code fences and prose.
    ///
    /// @throws GenerationException if the reply holds no JSON object
    static Map<String, Object> parseObject(String text, String schemaName) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new GenerationException("Reply for " + schemaName + " contains no JSON object");
        }
        try {
            return MAPPER.readValue(text.substring(start, end + 1), OBJECT_MAP);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Reply for " + schemaName + " is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private String chat(ChatRequest request) {
        ChatResponse response;
        try {
            response = model.chat(request);
        } catch (RuntimeException e) {
            Integer status = statusOf(e);
            logger.warning("Model " + id + " call failed" + (status != null ? " (HTTP " + status + ")" : "")
                    + ": " + e.getMessage());
            throw new GenerationException("Model " + id + " call failed: " + e.getMessage(), status, e);
        }
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new GenerationException("No response from model " + id);
        }
        logger.fine("Model " + id + " replied with " + response.aiMessage().text().length() + " chars");
        return response.aiMessage().text();
    }

    private static Integer statusOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpException http) {
                return http.statusCode();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }
}
