package io.stagewise.adapter.langchain4j;

import io.stagewise.core.llm.ModelSuite;
import java.util.List;

/// Model chains per pipeline role; the first model of a chain is tried first.
///
/// @param agent chains for the code-writing agent, not empty
/// @param objective chain for objective assessment and rewriting, not empty
/// @param selector chain for variable selection, not empty
/// @param reviewer chain for checklist validation and reports, not empty
/// @param critics one fixed model per critic identity, exactly {@link ModelSuite#CRITIC_COUNT}
public record ModelRoles(
        List<ModelSpec> agent,
        List<ModelSpec> objective,
        List<ModelSpec> selector,
        List<ModelSpec> reviewer,
        List<ModelSpec> critics) {

    public ModelRoles {
        agent = requireChain(agent, "agent");
        objective = requireChain(objective, "objective");
        selector = requireChain(selector, "selector");
        reviewer = requireChain(reviewer, "reviewer");
        critics = requireChain(critics, "critics");
        if (critics.size() != ModelSuite.CRITIC_COUNT) {
            throw new IllegalArgumentException(
                    "Exactly " + ModelSuite.CRITIC_COUNT + " critic models required, got " + critics.size());
        }
    }

    /// Anthropic-first agent, OpenAI-first objective model, reasoning models for selection and
    /// review, and two fixed critics from different providers.
    public static ModelRoles defaults() {
        return new ModelRoles(
                List.of(
                        ModelSpec.of("claude-3-5-sonnet-latest", 0.5),
                        ModelSpec.of("gpt-4o", 0.1),
                        ModelSpec.of("o4-mini")),
                List.of(
                        ModelSpec.of("gpt-4o", 0.5),
                        ModelSpec.of("claude-3-5-sonnet-latest", 0.1),
                        ModelSpec.of("o4-mini")),
                List.of(ModelSpec.of("o4-mini"), ModelSpec.of("o4-mini")),
                List.of(ModelSpec.of("o3-mini"), ModelSpec.of("o3-mini")),
                List.of(ModelSpec.of("o3"), ModelSpec.of("claude-opus-4-20250514")));
    }

    private static List<ModelSpec> requireChain(List<ModelSpec> chain, String role) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException(role + " chain must not be empty");
        }
        return List.copyOf(chain);
    }
}
