package io.stagewise.core.checkpoint;

/// Lifecycle status of a pipeline run as recorded in its checkpoints.
public enum RunStatus {
    RUNNING,
    WAITING_FOR_INPUT,
    COMPLETED,
    CANCELLED,
    ERROR;

    /// Returns whether no further node can run for a session in this status.
    ///
    /// @return true for COMPLETED and CANCELLED
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
