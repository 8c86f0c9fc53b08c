package io.stagewise.core.execution;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.interrupt.InterruptController;
import io.stagewise.core.interrupt.SuspendSignal;
import io.stagewise.core.state.PipelineState;
import java.time.Duration;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.logging.Logger;

/// Invokes a node under its {@link RetryPolicy}.
///
/// Suspension is never treated as a failure: a {@link SuspendSignal} propagates immediately.
/// Every attempt gets a fresh {@link NodeContext}, so a resume value is visible to each attempt.
public class RetryExecutor {

    private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.SYSTEM);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Runs a node until it succeeds, suspends or fails fatally.
    ///
    /// @param registration node and retry policy, not null
    /// @param state state the node reads, not null
    /// @param contexts builds the context for a 1-based attempt number, not null
    /// @param listener receives retry events, not null
    /// @return the node's command, never null
    /// @throws SuspendSignal if the node suspended
    /// @throws NodeExecutionException on a fatal failure or when attempts are exhausted
    public Command execute(
            Graph.Registration registration,
            PipelineState state,
            IntFunction<NodeContext> contexts,
            ExecutionListener listener) {
        RetryPolicy policy = registration.retryPolicy();
        int attempt = 1;
        while (true) {
            NodeContext context = contexts.apply(attempt);
            try {
                Command command = registration.node().execute(state, context);
                if (command == null) {
                    throw new IllegalStateException(
                            "Node '" + registration.id() + "' returned no command");
                }
                return command;
            } catch (SuspendSignal signal) {
                throw signal;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NodeExecutionException(registration.id(), attempt, e);
            } catch (Exception e) {
                if (attempt >= policy.maxAttempts() || !policy.classifier().isRetryable(e)) {
                    throw new NodeExecutionException(registration.id(), attempt, e);
                }
                Duration delay = policy.delayForAttempt(attempt);
                logger.warning(
                        "Node "
                                + registration.id()
                                + " failed on attempt "
                                + attempt
                                + ", retrying in "
                                + delay.toMillis()
                                + "ms: "
                                + e.getMessage());
                listener.onRetry(context.sessionId(), registration.id(), attempt, e, delay);
                pause(registration.id(), attempt, delay);
                attempt++;
            }
        }
    }

    /// Convenience overload for code paths without a resume value.
    public Command execute(
            Graph.Registration registration,
            PipelineState state,
            String sessionId,
            ExecutionListener listener) {
        InterruptController interrupts = InterruptController.none();
        return execute(
                registration,
                state,
                attempt ->
                        new DefaultNodeContext(
                                sessionId,
                                registration.id(),
                                attempt,
                                listener,
                                interrupts.slotFor(registration.id())),
                listener);
    }

    private void pause(String nodeId, int attempt, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(nodeId, attempt, e);
        }
    }
}
