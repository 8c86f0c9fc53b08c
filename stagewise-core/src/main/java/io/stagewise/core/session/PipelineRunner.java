package io.stagewise.core.session;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.checkpoint.Checkpointer;
import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.execution.CancellationToken;
import io.stagewise.core.execution.ExecutionListener;
import io.stagewise.core.execution.GraphExecutor;
import io.stagewise.core.execution.RunResult;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.state.PipelineState;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Entry point for running analysis sessions.
///
/// Wraps the {@link GraphExecutor} with session bookkeeping: one call in flight per session,
/// cancellation, quit words on resume and translation of run outcomes into
/// {@link PipelineEvent}s.
///
/// ### Usage
/// {@snippet :
/// RunResult result = runner.run("s-1", new PipelineRequest(objective, tables, options), sink);
/// if (result instanceof RunResult.Suspended) {
///     runner.resume("s-1", "pass", sink);
/// }
/// }
///
/// @implNote Thread-safe. The blocking methods run the session on the calling thread;
/// {@link #start}, {@link #respond} and {@link #recoverAsync} run it on the session executor.
public class PipelineRunner {

    private static final Logger logger = Logger.getLogger(PipelineRunner.class.getName());

    /// Resume values that cancel a waiting session instead of answering it.
    public static final Set<String> QUIT_WORDS = Set.of("q", "quit");

    private final GraphExecutor executor;
    private final Graph graph;
    private final PipelineDefinition definition;
    private final Checkpointer checkpointer;
    private final SessionRegistry registry;
    private final Executor sessionExecutor;

    /// Creates a runner.
    ///
    /// @param executor graph executor, not null
    /// @param graph the pipeline graph, built from `definition`, not null
    /// @param definition stage definitions, not null
    /// @param checkpointer checkpoint store shared with the executor, not null
    /// @param registry session registry, not null
    /// @param sessionExecutor runs asynchronous calls, not null; must not be the fan-out pool
    public PipelineRunner(
            GraphExecutor executor,
            Graph graph,
            PipelineDefinition definition,
            Checkpointer checkpointer,
            SessionRegistry registry,
            Executor sessionExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.checkpointer = Objects.requireNonNull(checkpointer, "checkpointer must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor must not be null");
    }

    /// Starts a new session and runs it until it completes, suspends, fails or is cancelled.
    ///
    /// @param sessionId new session id, not null
    /// @param request run input, not null
    /// @param sink event receiver, not null
    /// @return the run outcome, never null
    /// @throws SessionStateException if the session already exists or is running
    public RunResult run(String sessionId, PipelineRequest request, PipelineEventSink sink) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(request, "request must not be null");
        PipelineState initial = PipelineState.initial(
                request.objective(), definition.initialStages(), request.artifacts(), request.options());
        logger.info("Starting session " + sessionId + " with " + request.artifacts().size() + " artifacts");
        return guarded(sessionId, sink, token ->
                executor.start(graph, sessionId, initial, new EventBridge(sink), token));
    }

    /// Answers a waiting session. A quit word cancels the session instead.
    ///
    /// @param sessionId session id, not null
    /// @param value the answer, not null
    /// @param sink event receiver, not null
    /// @return the run outcome, never null
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionStateException if the session is not waiting for input
    public RunResult resume(String sessionId, String value, PipelineEventSink sink) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (isQuitWord(value)) {
            logger.info("Session " + sessionId + " quit by user");
            return cancelWaiting(sessionId, sink);
        }
        return guarded(sessionId, sink, token ->
                executor.resume(graph, sessionId, value, new EventBridge(sink), token));
    }

    /// Continues a session from its latest checkpoint after a crash or an error.
    ///
    /// @param sessionId session id, not null
    /// @param sink event receiver, not null
    /// @return the run outcome, never null
    public RunResult recover(String sessionId, PipelineEventSink sink) {
        return guarded(sessionId, sink, token ->
                executor.recover(graph, sessionId, new EventBridge(sink), token));
    }

    /// Asynchronous {@link #run}.
    public CompletableFuture<RunResult> start(String sessionId, PipelineRequest request, PipelineEventSink sink) {
        return async(() -> run(sessionId, request, sink));
    }

    /// Asynchronous {@link #resume}.
    public CompletableFuture<RunResult> respond(String sessionId, String value, PipelineEventSink sink) {
        return async(() -> resume(sessionId, value, sink));
    }

    /// Asynchronous {@link #recover}.
    public CompletableFuture<RunResult> recoverAsync(String sessionId, PipelineEventSink sink) {
        return async(() -> recover(sessionId, sink));
    }

    /// Cancels a session.
    ///
    /// A running session stops at the next superstep boundary. A session at rest gets a
    /// CANCELLED checkpoint right away. Finished sessions are left alone.
    ///
    /// @param sessionId session id, not null
    /// @param sink event receiver for the cancellation event of a session at rest, not null
    /// @return true if the session was running or has been cancelled
    /// @throws SessionNotFoundException if the session does not exist
    public boolean cancel(String sessionId, PipelineEventSink sink) {
        if (registry.cancel(sessionId)) {
            logger.info("Cancellation requested for running session " + sessionId);
            return true;
        }
        Checkpoint latest = latest(sessionId);
        if (latest.status().isTerminal()) {
            return false;
        }
        cancelWaiting(sessionId, sink);
        return true;
    }

    /// Returns the status view of a session.
    ///
    /// @param sessionId session id, not null
    /// @return the view, or empty for an unknown session
    public Optional<SessionInfo> status(String sessionId) {
        return checkpointer.getLatest(sessionId).map(SessionInfo::from);
    }

    /// Returns every checkpoint of a session, oldest first.
    public List<Checkpoint> history(String sessionId) {
        return checkpointer.history(sessionId);
    }

    public boolean isRunning(String sessionId) {
        return registry.isActive(sessionId);
    }

    /// Whether a resume value is one of {@link #QUIT_WORDS}, ignoring case and surrounding blanks.
    public static boolean isQuitWord(String value) {
        return QUIT_WORDS.contains(value.strip().toLowerCase(Locale.ROOT));
    }

    private RunResult cancelWaiting(String sessionId, PipelineEventSink sink) {
        CancellationToken token = registry.acquire(sessionId);
        try {
            Checkpoint latest = latest(sessionId);
            if (latest.status().isTerminal()) {
                throw new SessionStateException(
                        "Session " + sessionId + " already finished with status " + latest.status());
            }
            checkpointer.put(latest.withStatus(RunStatus.CANCELLED, latest.sequence() + 1, null));
            token.cancel();
            sink.publish(new PipelineEvent.Cancelled(sessionId));
            return new RunResult.Cancelled(latest.state());
        } finally {
            registry.release(sessionId);
        }
    }

    private RunResult guarded(String sessionId, PipelineEventSink sink, SessionCall call) {
        CancellationToken token = registry.acquire(sessionId);
        try {
            RunResult result = call.run(token);
            publishOutcome(sessionId, result, sink);
            return result;
        } finally {
            registry.release(sessionId);
        }
    }

    private void publishOutcome(String sessionId, RunResult result, PipelineEventSink sink) {
        if (result instanceof RunResult.Completed completed) {
            sink.publish(new PipelineEvent.Completed(sessionId, completed.state().finalReport()));
        } else if (result instanceof RunResult.Suspended suspended) {
            sink.publish(new PipelineEvent.InputRequired(sessionId, suspended.interrupt().message()));
        } else if (result instanceof RunResult.Failed failed) {
            sink.publish(new PipelineEvent.Failed(sessionId, failed.error()));
        } else if (result instanceof RunResult.Cancelled) {
            sink.publish(new PipelineEvent.Cancelled(sessionId));
        }
    }

    private Checkpoint latest(String sessionId) {
        return checkpointer.getLatest(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private CompletableFuture<RunResult> async(Supplier<RunResult> call) {
        return CompletableFuture.supplyAsync(call, sessionExecutor);
    }

    @FunctionalInterface
    private interface SessionCall {
        RunResult run(CancellationToken token);
    }

    /// Forwards node notifications to the caller's sink.
    private static final class EventBridge implements ExecutionListener {

        private final PipelineEventSink sink;

        private EventBridge(PipelineEventSink sink) {
            this.sink = sink;
        }

        @Override
        public void onProgress(String sessionId, String message) {
            sink.publish(new PipelineEvent.Progress(sessionId, message));
        }

        @Override
        public void onStageStarted(String sessionId, int stageOrder) {
            sink.publish(new PipelineEvent.StageStarted(sessionId, stageOrder));
        }
    }
}
