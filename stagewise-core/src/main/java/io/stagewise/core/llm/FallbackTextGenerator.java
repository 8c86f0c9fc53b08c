package io.stagewise.core.llm;

import io.stagewise.core.state.ChatMessage;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Chains generators: each call goes to the first, and on failure to the next in order.
///
/// The last failure is rethrown when every generator failed.
public class FallbackTextGenerator implements TextGenerator {

    private static final Logger logger = Logger.getLogger(FallbackTextGenerator.class.getName());

    private final List<TextGenerator> chain;

    public FallbackTextGenerator(List<TextGenerator> chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Fallback chain must not be empty");
        }
        this.chain = List.copyOf(chain);
    }

    public static TextGenerator of(TextGenerator... generators) {
        return generators.length == 1 ? generators[0] : new FallbackTextGenerator(List.of(generators));
    }

    @Override
    public String id() {
        return chain.stream().map(TextGenerator::id).collect(Collectors.joining(" > "));
    }

    @Override
    public String generate(List<ChatMessage> conversation) {
        return firstSuccessful(g -> g.generate(conversation));
    }

    @Override
    public <T> T generate(List<ChatMessage> conversation, OutputSchema<T> schema) {
        return firstSuccessful(g -> g.generate(conversation, schema));
    }

    private <R> R firstSuccessful(Function<TextGenerator, R> call) {
        RuntimeException last = null;
        for (TextGenerator generator : chain) {
            try {
                return call.apply(generator);
            } catch (RuntimeException e) {
                logger.warning("Generator " + generator.id() + " failed, trying next: " + e.getMessage());
                last = e;
            }
        }
        throw last;
    }
}
