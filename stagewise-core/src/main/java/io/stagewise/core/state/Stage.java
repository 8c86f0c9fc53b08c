package io.stagewise.core.state;

import java.util.Objects;

/// Descriptor of one ordered phase of the pipeline.
///
/// Stages are created with defaults when a run starts. The completion flag and the
/// report are written exactly once, by the node that closes the stage; afterwards the
/// descriptor is frozen.
///
/// @param order position of the stage in the pipeline, unique and positive
/// @param name human-readable stage name, not null
/// @param description short description of the stage goal, never null (may be empty)
/// @param completed whether the stage has been closed
/// @param report free-text report written when the stage closed, never null (may be empty)
/// @see PipelineState#currentStage()
public record Stage(int order, String name, String description, boolean completed, String report) {

    public Stage {
        if (order <= 0) {
            throw new IllegalArgumentException("order must be positive, got " + order);
        }
        Objects.requireNonNull(name, "name must not be null");
        description = description != null ? description : "";
        report = report != null ? report : "";
    }

    /// Creates a stage that has not started yet.
    ///
    /// @param order stage position, positive
    /// @param name stage name, not null
    /// @param description stage description, may be null
    /// @return a pending stage descriptor, never null
    public static Stage pending(int order, String name, String description) {
        return new Stage(order, name, description, false, "");
    }

    /// Returns a completed copy of this stage carrying the given report.
    ///
    /// @param report the stage report, may be null (stored as empty)
    /// @return completed copy, never null
    /// @throws IllegalStateException if this stage is already completed
    public Stage complete(String report) {
        if (completed) {
            throw new IllegalStateException("Stage " + order + " is already completed");
        }
        return new Stage(order, name, description, true, report);
    }
}
