package io.stagewise.core.llm;

import java.util.List;
import java.util.Objects;

/// Generators for each role in the pipeline.
///
/// @param agent drives the code-writing conversation, not null
/// @param objective assesses and rewrites the objective, not null
/// @param selector chooses values to persist after a stage, not null
/// @param reviewer runs the checklist validation and writes reports, not null
/// @param critics independent critic identities, exactly two, in evaluation order
public record ModelSuite(
        TextGenerator agent,
        TextGenerator objective,
        TextGenerator selector,
        TextGenerator reviewer,
        List<TextGenerator> critics) {

    public static final int CRITIC_COUNT = 2;

    public ModelSuite {
        Objects.requireNonNull(agent, "agent must not be null");
        Objects.requireNonNull(objective, "objective must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(reviewer, "reviewer must not be null");
        critics = List.copyOf(critics);
        if (critics.size() != CRITIC_COUNT) {
            throw new IllegalArgumentException(
                    "Exactly " + CRITIC_COUNT + " critics required, got " + critics.size());
        }
    }

    /// Uses one generator for every role; handy for tests and single-model setups.
    ///
    /// @param generator the generator, not null
    /// @return a suite, never null
    public static ModelSuite single(TextGenerator generator) {
        return new ModelSuite(generator, generator, generator, generator, List.of(generator, generator));
    }
}
