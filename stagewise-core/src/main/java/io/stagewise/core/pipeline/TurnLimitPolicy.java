package io.stagewise.core.pipeline;

/// What happens when a stage exhausts its message budget.
public enum TurnLimitPolicy {
    /// Stop the whole run; the final report explains why.
    TERMINATE_RUN,
    /// Proceed to validation with whatever the stage produced.
    CONTINUE_TO_VALIDATION
}
