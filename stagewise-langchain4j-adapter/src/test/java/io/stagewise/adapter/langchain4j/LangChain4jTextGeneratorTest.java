package io.stagewise.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.stagewise.core.llm.GenerationException;
import io.stagewise.core.pipeline.StructuredOutputs;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jTextGeneratorTest {

    private static final List<ChatMessage> CONVERSATION =
            List.of(ChatMessage.system("You are a data scientist."), ChatMessage.user("Load the data."));

    @Mock private ChatModel model;

    private static ChatResponse reply(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Nested
    class PlainGeneration {

        @Test
        void shouldMapRolesToLangChain4jMessages() {
            // Given
            when(model.chat(any(ChatRequest.class))).thenReturn(reply("```python\nx = 1\n```"));
            var generator = new LangChain4jTextGenerator("gpt-4o", model, true);
            var captor = ArgumentCaptor.forClass(ChatRequest.class);

            // When
            String text = generator.generate(List.of(
                    ChatMessage.system("sys"), ChatMessage.user("hi"), ChatMessage.assistant("hello")));

            // Then
            assertThat(text).isEqualTo("```python\nx = 1\n```");
            verify(model).chat(captor.capture());
            assertThat(captor.getValue().messages())
                    .containsExactly(SystemMessage.from("sys"), UserMessage.from("hi"), AiMessage.from("hello"));
        }

        @Test
        void shouldRejectEmptyConversation() {
            var generator = new LangChain4jTextGenerator("gpt-4o", model, true);

            assertThatThrownBy(() -> generator.generate(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldWrapProviderFailureWithHttpStatus() {
            // Given
            when(model.chat(any(ChatRequest.class)))
                    .thenThrow(new RuntimeException("wrapped", new HttpException(429, "rate limited")));
            var generator = new LangChain4jTextGenerator("claude-3-5-sonnet-latest", model, false);

            // When / Then
            assertThatThrownBy(() -> generator.generate(CONVERSATION))
                    .isInstanceOfSatisfying(GenerationException.class, e -> {
                        assertThat(e.statusCode()).hasValue(429);
                        assertThat(e.getMessage()).contains("claude-3-5-sonnet-latest");
                    });
        }

        @Test
        void shouldLeaveStatusEmptyForTransportFailure() {
            when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("connection reset"));
            var generator = new LangChain4jTextGenerator("gpt-4o", model, true);

            assertThatThrownBy(() -> generator.generate(CONVERSATION))
                    .isInstanceOfSatisfying(
                            GenerationException.class, e -> assertThat(e.statusCode()).isEmpty());
        }
    }

    @Nested
    class StructuredGeneration {

        @Test
        void shouldRequestNativeJsonSchemaWhenSupported() {
            // Given
            when(model.chat(any(ChatRequest.class))).thenReturn(reply(
                    "{\"chain_of_thought_summary\": \"- ok\", \"pass_the_validation\": true,"
                            + " \"message_to_user\": \"\"}"));
            var generator = new LangChain4jTextGenerator("gpt-4o", model, true);
            var captor = ArgumentCaptor.forClass(ChatRequest.class);

            // When
            ValidationResult result = generator.generate(CONVERSATION, StructuredOutputs.VALIDATION);

            // Then
            assertThat(result.passed()).isTrue();
            assertThat(result.reasoningSummary()).isEqualTo("- ok");
            verify(model).chat(captor.capture());
            ChatRequest request = captor.getValue();
            assertThat(request.responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
            assertThat(request.responseFormat().jsonSchema().name()).isEqualTo("ValidationResult");
            assertThat(request.messages()).hasSize(2);
        }

        @Test
        void shouldAppendSchemaInstructionWhenNativeSchemaUnsupported() {
            // Given
            when(model.chat(any(ChatRequest.class))).thenReturn(reply(
                    "Here you go:\n```json\n{\"chain_of_thought_summary\": \"- missing plot\","
                            + " \"pass_the_validation\": false, \"message_to_user\": \"Add a plot\"}\n```"));
            var generator = new LangChain4jTextGenerator("claude-opus-4-20250514", model, false);
            var captor = ArgumentCaptor.forClass(ChatRequest.class);

            // When
            ValidationResult result = generator.generate(CONVERSATION, StructuredOutputs.VALIDATION);

            // Then
            assertThat(result.passed()).isFalse();
            assertThat(result.messageToUser()).isEqualTo("Add a plot");
            verify(model).chat(captor.capture());
            List<dev.langchain4j.data.message.ChatMessage> sent = captor.getValue().messages();
            assertThat(sent).hasSize(3);
            assertThat(((UserMessage) sent.get(2)).singleText())
                    .startsWith(LangChain4jTextGenerator.JSON_INSTRUCTION)
                    .contains("pass_the_validation");
        }

        @Test
        void shouldFailWhenReplyHoldsNoJsonObject() {
            when(model.chat(any(ChatRequest.class))).thenReturn(reply("I cannot answer that."));
            var generator = new LangChain4jTextGenerator("claude-3-5-sonnet-latest", model, false);

            assertThatThrownBy(() -> generator.generate(CONVERSATION, StructuredOutputs.VALIDATION))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("no JSON object");
        }

        @Test
        void shouldFailWhenRequiredFieldMissing() {
            when(model.chat(any(ChatRequest.class))).thenReturn(reply("{\"chain_of_thought_summary\": \"x\"}"));
            var generator = new LangChain4jTextGenerator("gpt-4o", model, true);

            assertThatThrownBy(() -> generator.generate(CONVERSATION, StructuredOutputs.VALIDATION))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("pass_the_validation");
        }
    }
}
