package io.stagewise.core.graph;

/// Services available to a node during one invocation.
public interface NodeContext {

    /// Returns the id of the session the node runs in.
    ///
    /// @return session id, not null
    String sessionId();

    /// Returns the fully qualified id of the running node.
    ///
    /// @return node id, not null
    String nodeId();

    /// Returns the 1-based attempt number of this invocation.
    ///
    /// @return attempt number, at least 1
    int attempt();

    /// Publishes a one-line progress message to the caller.
    ///
    /// @param message progress text, not null
    void progress(String message);

    /// Announces that a stage has begun.
    ///
    /// @param stageOrder order of the stage
    void stageStarted(int stageOrder);

    /// Suspends the run until an external value arrives.
    ///
    /// On first call the run halts and the message is surfaced to the caller. When the run is
    /// resumed the node is invoked again from the top and this call returns the supplied value.
    ///
    /// @param message question or summary for the caller, not null
    /// @return the resume value, never null
    String suspend(String message);
}
