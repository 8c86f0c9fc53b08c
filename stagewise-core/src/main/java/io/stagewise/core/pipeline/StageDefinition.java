package io.stagewise.core.pipeline;

import io.stagewise.core.state.Stage;
import java.util.Objects;

/// Static description of one pipeline stage.
///
/// @param order stage order, positive and unique within a pipeline
/// @param scope graph scope the stage's nodes are registered under, not null
/// @param name stage name, not null
/// @param description stage description, never null
/// @param kind sub-graph shape, not null
/// @param maxMessageTurns agent turn budget, positive (ignored for REPORT stages)
/// @param checklist checklist for validation, never null
/// @param criticGuide optional rule for critics, never null (may be empty)
/// @param instructions system prompt template, never null
/// @param turnLimitPolicy behaviour when the budget is exhausted, not null
public record StageDefinition(
        int order,
        String scope,
        String name,
        String description,
        StageKind kind,
        int maxMessageTurns,
        String checklist,
        String criticGuide,
        String instructions,
        TurnLimitPolicy turnLimitPolicy) {

    public StageDefinition {
        if (order <= 0) {
            throw new IllegalArgumentException("order must be positive, got " + order);
        }
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(turnLimitPolicy, "turnLimitPolicy must not be null");
        if (maxMessageTurns <= 0) {
            throw new IllegalArgumentException("maxMessageTurns must be positive, got " + maxMessageTurns);
        }
        description = description != null ? description : "";
        checklist = checklist != null ? checklist : "";
        criticGuide = criticGuide != null ? criticGuide : "";
        instructions = instructions != null ? instructions : "";
    }

    /// Returns the label used in messages to the user, e.g. "Stage 2: Data Cleaning".
    public String label() {
        return "Stage " + order + ": " + name;
    }

    public Stage toPendingStage() {
        return Stage.pending(order, name, description);
    }

    /// Returns a copy with overrides applied; null override fields keep the current value.
    ///
    /// @param overrides overrides, not null
    /// @return the overridden definition, never null
    public StageDefinition with(StageOverrides overrides) {
        return new StageDefinition(
                order,
                scope,
                name,
                description,
                kind,
                overrides.maxMessageTurns() != null ? overrides.maxMessageTurns() : maxMessageTurns,
                overrides.checklist() != null ? overrides.checklist() : checklist,
                overrides.criticGuide() != null ? overrides.criticGuide() : criticGuide,
                instructions,
                overrides.turnLimitPolicy() != null ? overrides.turnLimitPolicy() : turnLimitPolicy);
    }
}
