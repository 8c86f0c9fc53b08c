package io.stagewise.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.stagewise.core.llm.FallbackTextGenerator;
import io.stagewise.core.llm.ModelSuite;
import io.stagewise.core.llm.ModelSuiteProvider;
import io.stagewise.core.llm.TextGenerator;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link ModelSuiteProvider}.
///
/// Creates a {@link ChatModel} per {@link ModelSpec}, chosen by model name prefix:
///
/// | Prefix | Provider | API key |
/// |--------|----------|---------|
/// | `claude` | Anthropic | `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1`, `o3`, `o4` | OpenAI | `OPENAI_API_KEY` |
/// | `gemini`, `gemma` | Google AI | `GOOGLE_API_KEY` |
/// | `deepseek` | DeepSeek (OpenAI-compatible) | `DEEPSEEK_API_KEY` |
///
/// Chains of more than one model become a {@link FallbackTextGenerator}.
///
/// @implNote Stateless and thread-safe. Each call to {@link #create} builds new model
/// instances.
public class LangChain4jModelFactory implements ModelSuiteProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    private static final int DEFAULT_MAX_TOKENS = 8192;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final ModelRoles roles;
    private final Duration timeout;

    public LangChain4jModelFactory() {
        this(ModelRoles.defaults(), DEFAULT_TIMEOUT);
    }

    /// Creates a factory.
    ///
    /// @param roles model chains per role, not null
    /// @param timeout per-call timeout, not null
    public LangChain4jModelFactory(ModelRoles roles, Duration timeout) {
        this.roles = Objects.requireNonNull(roles, "roles must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public ModelSuite create(Map<String, String> credentials) {
        logger.info("Creating LangChain4j models, agent chain: " + roles.agent());
        return new ModelSuite(
                chain(roles.agent(), credentials),
                chain(roles.objective(), credentials),
                chain(roles.selector(), credentials),
                chain(roles.reviewer(), credentials),
                roles.critics().stream().map(spec -> generator(spec, credentials)).toList());
    }

    static boolean supportsModel(String modelName) {
        return modelName != null && provider(modelName) != null;
    }

    private TextGenerator chain(List<ModelSpec> specs, Map<String, String> credentials) {
        if (specs.size() == 1) {
            return generator(specs.get(0), credentials);
        }
        return new FallbackTextGenerator(specs.stream().map(spec -> generator(spec, credentials)).toList());
    }

    TextGenerator generator(ModelSpec spec, Map<String, String> credentials) {
        Provider provider = provider(spec.modelName());
        if (provider == null) {
            throw new IllegalArgumentException("Unsupported model: " + spec.modelName());
        }
        ChatModel model = switch (provider) {
            case ANTHROPIC -> createAnthropicModel(spec, credentials);
            case OPENAI -> createOpenAiModel(spec, credentials, null);
            case GOOGLE -> createGoogleAiModel(spec, credentials);
            case DEEPSEEK -> createOpenAiModel(spec, credentials, "https://api.deepseek.com");
        };
        return new LangChain4jTextGenerator(spec.modelName(), model, provider != Provider.ANTHROPIC);
    }

    private ChatModel createAnthropicModel(ModelSpec spec, Map<String, String> credentials) {
        var builder = AnthropicChatModel.builder()
                .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                .modelName(spec.modelName())
                .maxTokens(DEFAULT_MAX_TOKENS)
                .timeout(timeout);
        if (spec.temperature() != null) builder.temperature(spec.temperature());
        return builder.build();
    }

    /// Creates an OpenAI-compatible model, used for both OpenAI and DeepSeek (via base URL).
    private ChatModel createOpenAiModel(ModelSpec spec, Map<String, String> credentials, String baseUrl) {
        String apiKey = baseUrl != null
                ? requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY")
                : requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(spec.modelName())
                .timeout(timeout);
        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (spec.temperature() != null) builder.temperature(spec.temperature());
        return builder.build();
    }

    private ChatModel createGoogleAiModel(ModelSpec spec, Map<String, String> credentials) {
        var builder = GoogleAiGeminiChatModel.builder()
                .apiKey(requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY"))
                .modelName(spec.modelName())
                .maxOutputTokens(DEFAULT_MAX_TOKENS)
                .timeout(timeout);
        if (spec.temperature() != null) builder.temperature(spec.temperature());
        return builder.build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException("API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private static Provider provider(String modelName) {
        if (modelName.startsWith("claude")) {
            return Provider.ANTHROPIC;
        }
        if (modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("o4")) {
            return Provider.OPENAI;
        }
        if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return Provider.GOOGLE;
        }
        if (modelName.startsWith("deepseek")) {
            return Provider.DEEPSEEK;
        }
        return null;
    }

    private enum Provider {
        ANTHROPIC,
        OPENAI,
        GOOGLE,
        DEEPSEEK
    }
}
