package io.stagewise.core.execution;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.graph.Command;
import io.stagewise.core.interrupt.PendingInterrupt;
import java.time.Duration;

/// Listener for graph execution lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override only the
/// events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onNodeStart(session, node)            about to invoke a node
/// onProgress / onStageStarted           emitted by the node while it runs
/// onRetry(session, node, attempt, ...)  transient failure, waiting before the next attempt
/// onNodeComplete(session, node, cmd)    node returned a command (state NOT yet merged)
/// onCheckpoint(checkpoint)              superstep merged and persisted
/// onSuspended(session, interrupt)       run halted waiting for input
/// ```
///
/// @implNote Fan-out branches run on worker threads; implementations must be thread-safe.
public interface ExecutionListener {

    default void onNodeStart(String sessionId, String nodeId) {}

    default void onNodeComplete(String sessionId, String nodeId, Command command) {}

    /// Called after a retryable failure, before sleeping.
    ///
    /// @param sessionId session id, not null
    /// @param nodeId failing node, not null
    /// @param failedAttempt 1-based attempt that failed
    /// @param error the failure, not null
    /// @param delay wait before the next attempt, not null
    default void onRetry(
            String sessionId, String nodeId, int failedAttempt, Throwable error, Duration delay) {}

    default void onProgress(String sessionId, String message) {}

    default void onStageStarted(String sessionId, int stageOrder) {}

    /// Called once the checkpoint of a superstep is durable.
    ///
    /// @param checkpoint the persisted checkpoint, not null
    default void onCheckpoint(Checkpoint checkpoint) {}

    default void onSuspended(String sessionId, PendingInterrupt interrupt) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
