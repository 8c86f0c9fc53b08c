package io.stagewise.core.execution;

import io.stagewise.core.interrupt.PendingInterrupt;
import io.stagewise.core.state.PipelineState;

/// How a call into the {@link GraphExecutor} ended.
///
/// Every variant carries the state of the last durable checkpoint.
public sealed interface RunResult {

    PipelineState state();

    /// The graph ran to its end or a node terminated the run.
    record Completed(PipelineState state) implements RunResult {}

    /// A node suspended; the run continues with {@link GraphExecutor#resume}.
    record Suspended(PipelineState state, PendingInterrupt interrupt) implements RunResult {}

    /// A node failed fatally; the run is in ERROR status.
    record Failed(PipelineState state, String error, Throwable cause) implements RunResult {}

    /// The run was cancelled between supersteps.
    record Cancelled(PipelineState state) implements RunResult {}
}
