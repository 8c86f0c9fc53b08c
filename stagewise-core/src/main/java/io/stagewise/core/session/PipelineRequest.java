package io.stagewise.core.session;

import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.RunOptions;
import java.util.List;
import java.util.Objects;

/// Input of a new pipeline run.
///
/// @param objective the user's objective, not null or blank
/// @param artifacts initial artifacts, typically the input tables, never null
/// @param options run flags, never null (defaults when null)
public record PipelineRequest(String objective, List<Artifact> artifacts, RunOptions options) {

    public PipelineRequest {
        Objects.requireNonNull(objective, "objective must not be null");
        if (objective.isBlank()) {
            throw new IllegalArgumentException("objective must not be blank");
        }
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
        options = options != null ? options : RunOptions.defaults();
    }
}
