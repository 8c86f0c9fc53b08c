package io.stagewise.core.graph;

import io.stagewise.core.state.PipelineState;

/// A unit of work in a {@link Graph}.
///
/// Nodes read the current state, perform their side effects and describe the result as a
/// {@link Command}. They never mutate state. A node registered with retries must produce the
/// same command when invoked again after a transient failure.
///
/// {@snippet :
/// Node greet = (state, context) -> Command.next(
///         StatePatch.builder().append(ChatMessage.user("hello")).build());
/// }
@FunctionalInterface
public interface Node {

    /// Executes the node.
    ///
    /// @param state the current state, read-only, not null
    /// @param context per-invocation services, not null
    /// @return the command to apply, not null
    /// @throws Exception on any failure; the retry policy decides whether it is retried
    Command execute(PipelineState state, NodeContext context) throws Exception;
}
