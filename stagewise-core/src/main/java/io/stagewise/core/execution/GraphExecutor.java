package io.stagewise.core.execution;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.checkpoint.Checkpointer;
import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.graph.GraphDefinitionException;
import io.stagewise.core.graph.Route;
import io.stagewise.core.interrupt.InterruptController;
import io.stagewise.core.interrupt.PendingInterrupt;
import io.stagewise.core.interrupt.SuspendSignal;
import io.stagewise.core.session.SessionNotFoundException;
import io.stagewise.core.session.SessionStateException;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Superstep execution engine for {@link Graph}s.
///
/// A run advances in supersteps. Each superstep invokes every node of the current frontier,
/// merges their patches into the state in frontier order, computes the next frontier from the
/// returned routes and persists a {@link Checkpoint}. A single node runs on the calling thread;
/// a fan-out frontier runs on the executor service and is awaited as a whole.
///
/// ### Contracts
/// - **Atomic superstep**: if any node fails fatally, no patch of the superstep is applied and
///   an ERROR checkpoint keeps the previous state and frontier
/// - **Suspension**: a suspended node halts the run with no patch applied; on resume the same
///   frontier runs again with the resume value delivered to the suspended node
/// - **Durability**: every superstep ends with a checkpoint; resume and recovery rely only on
///   the latest checkpoint
/// - **Cancellation**: a cancelled token is terminal; a superstep that suspends or fails after
///   the token was set ends the run as CANCELLED
/// - **Joins**: a join node enters the frontier only once all declared branches routed to it
///
/// @implNote Thread-safe. Concurrent runs must use distinct session ids; the caller guarantees
/// at most one in-flight call per session.
///
/// @see RetryExecutor
/// @see Checkpointer
public class GraphExecutor {

    private static final Logger logger = Logger.getLogger(GraphExecutor.class.getName());

    private final ExecutorService executorService;
    private final Checkpointer checkpointer;
    private final RetryExecutor retryExecutor;

    /// Creates a graph executor.
    ///
    /// @param executorService pool for fan-out branches, not null; not shut down by this class
    /// @param checkpointer durable checkpoint store, not null
    /// @param retryExecutor per-node retry wrapper, not null
    public GraphExecutor(
            ExecutorService executorService, Checkpointer checkpointer, RetryExecutor retryExecutor) {
        this.executorService = Objects.requireNonNull(executorService, "executorService must not be null");
        this.checkpointer = Objects.requireNonNull(checkpointer, "checkpointer must not be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    }

    /// Starts a new run at the graph's entry node.
    ///
    /// @param graph graph to run, not null
    /// @param sessionId new session id, not null
    /// @param initial initial state, not null
    /// @param listener lifecycle listener, not null
    /// @param token cancellation flag, not null
    /// @return how the run ended or paused, never null
    /// @throws SessionStateException if the session already has checkpoints
    public RunResult start(
            Graph graph,
            String sessionId,
            PipelineState initial,
            ExecutionListener listener,
            CancellationToken token) {
        if (checkpointer.getLatest(sessionId).isPresent()) {
            throw new SessionStateException("Session already exists: " + sessionId);
        }
        Run run = new Run(graph, sessionId, listener, token, 0L);
        run.state = initial;
        run.frontier = List.of(graph.entry());
        run.barrier = new SuperstepBarrier();
        run.persist(RunStatus.RUNNING, null, null);
        return run.loop(InterruptController.none());
    }

    /// Resumes a suspended run, delivering a value to the suspended node.
    ///
    /// @param graph the graph the run was started with, not null
    /// @param sessionId session id, not null
    /// @param value resume value, not null
    /// @param listener lifecycle listener, not null
    /// @param token cancellation flag, not null
    /// @return how the run ended or paused, never null
    /// @throws SessionNotFoundException if the session has no checkpoint
    /// @throws SessionStateException if the session is not waiting for input
    public RunResult resume(
            Graph graph,
            String sessionId,
            String value,
            ExecutionListener listener,
            CancellationToken token) {
        Objects.requireNonNull(value, "value must not be null");
        Checkpoint latest = latest(sessionId);
        if (latest.status() != RunStatus.WAITING_FOR_INPUT || latest.pendingInterrupt() == null) {
            throw new SessionStateException(
                    "Session " + sessionId + " is not waiting for input (status " + latest.status() + ")");
        }
        Run run = restore(graph, latest, listener, token);
        logger.info("Resuming session " + sessionId + " at node " + latest.pendingInterrupt().nodeId());
        return run.loop(InterruptController.resuming(latest.pendingInterrupt().nodeId(), value));
    }

    /// Continues a run from its latest checkpoint after a crash or a fatal error.
    ///
    /// @param graph the graph the run was started with, not null
    /// @param sessionId session id, not null
    /// @param listener lifecycle listener, not null
    /// @param token cancellation flag, not null
    /// @return how the run ended or paused, never null
    /// @throws SessionNotFoundException if the session has no checkpoint
    /// @throws SessionStateException if the latest checkpoint is not RUNNING or ERROR
    public RunResult recover(
            Graph graph, String sessionId, ExecutionListener listener, CancellationToken token) {
        Checkpoint latest = latest(sessionId);
        if (latest.status() != RunStatus.RUNNING && latest.status() != RunStatus.ERROR) {
            throw new SessionStateException(
                    "Session " + sessionId + " cannot be recovered from status " + latest.status());
        }
        Run run = restore(graph, latest, listener, token);
        logger.info("Recovering session " + sessionId + " at " + latest.nextNodes());
        return run.loop(InterruptController.none());
    }

    private Run restore(
            Graph graph, Checkpoint checkpoint, ExecutionListener listener, CancellationToken token) {
        Run run = new Run(graph, checkpoint.sessionId(), listener, token, checkpoint.sequence() + 1);
        run.state = checkpoint.state();
        run.frontier = checkpoint.nextNodes();
        run.barrier = SuperstepBarrier.restore(checkpoint.barrierArrivals());
        return run;
    }

    private Checkpoint latest(String sessionId) {
        return checkpointer
                .getLatest(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /// Mutable cursor of one executor call.
    private final class Run {

        private final Graph graph;
        private final String sessionId;
        private final ExecutionListener listener;
        private final CancellationToken token;
        private long sequence;
        private PipelineState state;
        private List<String> frontier;
        private SuperstepBarrier barrier;

        private Run(
                Graph graph,
                String sessionId,
                ExecutionListener listener,
                CancellationToken token,
                long sequence) {
            this.graph = graph;
            this.sessionId = sessionId;
            this.listener = listener;
            this.token = token;
            this.sequence = sequence;
        }

        RunResult loop(InterruptController interrupts) {
            InterruptController current = interrupts;
            while (true) {
                if (token.isCancelled()) {
                    return cancelled();
                }
                if (frontier.isEmpty()) {
                    persist(RunStatus.COMPLETED, null, null);
                    return new RunResult.Completed(state);
                }

                List<BranchResult> results = runSuperstep(current);
                current = InterruptController.none();

                Throwable failure = results.stream()
                        .filter(BranchResult::isFailed)
                        .map(BranchResult::failure)
                        .findFirst()
                        .orElse(null);
                List<PendingInterrupt> interruptsRaised = results.stream()
                        .filter(BranchResult::isSuspended)
                        .map(BranchResult::interrupt)
                        .toList();
                if (failure == null && interruptsRaised.size() > 1) {
                    failure = new IllegalStateException(
                            "More than one node suspended in one superstep: " + frontier);
                }
                if (failure != null) {
                    return fail(failure);
                }
                if (!interruptsRaised.isEmpty()) {
                    if (token.isCancelled()) {
                        return cancelled();
                    }
                    PendingInterrupt interrupt = interruptsRaised.get(0);
                    persist(RunStatus.WAITING_FOR_INPUT, interrupt, null);
                    listener.onSuspended(sessionId, interrupt);
                    logger.info("Session " + sessionId + " waiting for input at " + interrupt.nodeId());
                    return new RunResult.Suspended(state, interrupt);
                }

                boolean terminate;
                SuperstepBarrier before = SuperstepBarrier.restore(barrier.snapshot());
                try {
                    List<StatePatch> patches = new ArrayList<>();
                    results.forEach(r -> patches.add(r.command().patch()));
                    PipelineState merged = state.apply(patches);
                    Transition transition = nextFrontier(results);
                    state = merged;
                    frontier = transition.frontier();
                    terminate = transition.terminate();
                } catch (RuntimeException e) {
                    barrier = before;
                    return fail(e);
                }

                if (terminate) {
                    frontier = List.of();
                    persist(RunStatus.COMPLETED, null, null);
                    logger.info("Session " + sessionId + " terminated by node");
                    return new RunResult.Completed(state);
                }
                persist(RunStatus.RUNNING, null, null);
            }
        }

        private List<BranchResult> runSuperstep(InterruptController interrupts) {
            if (frontier.size() == 1) {
                return List.of(invoke(frontier.get(0), interrupts));
            }
            List<Future<BranchResult>> futures = new ArrayList<>();
            for (String nodeId : frontier) {
                futures.add(executorService.submit(() -> invoke(nodeId, interrupts)));
            }
            List<BranchResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                String nodeId = frontier.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    results.add(BranchResult.failed(nodeId, e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(f -> f.cancel(true));
                    results.add(BranchResult.failed(nodeId, e));
                }
            }
            return results;
        }

        private BranchResult invoke(String nodeId, InterruptController interrupts) {
            Graph.Registration registration;
            try {
                registration = graph.registration(nodeId);
            } catch (GraphDefinitionException e) {
                return BranchResult.failed(nodeId, e);
            }
            listener.onNodeStart(sessionId, nodeId);
            try {
                Command command = retryExecutor.execute(
                        registration,
                        state,
                        attempt -> new DefaultNodeContext(
                                sessionId, nodeId, attempt, listener, interrupts.slotFor(nodeId)),
                        listener);
                listener.onNodeComplete(sessionId, nodeId, command);
                return BranchResult.success(nodeId, command);
            } catch (SuspendSignal signal) {
                return BranchResult.suspended(nodeId, signal.interrupt());
            } catch (RuntimeException e) {
                return BranchResult.failed(nodeId, e);
            }
        }

        private Transition nextFrontier(List<BranchResult> results) {
            Set<String> next = new LinkedHashSet<>();
            boolean terminate = false;
            for (BranchResult result : results) {
                String from = result.nodeId();
                Route route = result.command().route();
                List<String> targets = new ArrayList<>();
                if (route instanceof Route.Next) {
                    targets.add(graph.staticNext(from)
                            .orElseThrow(() -> new GraphDefinitionException(
                                    "Node '" + from + "' returned Next but declares no edge")));
                } else if (route instanceof Route.Goto go) {
                    targets.add(graph.resolve(from, go.target()));
                } else if (route instanceof Route.FanOut fanOut) {
                    fanOut.targets().forEach(t -> targets.add(graph.resolve(from, t)));
                } else if (route instanceof Route.End) {
                    graph.exitFor(from).ifPresent(targets::add);
                } else if (route instanceof Route.Terminate) {
                    terminate = true;
                }
                for (String target : targets) {
                    if (!graph.isJoin(target) || barrier.arrive(graph, target, from)) {
                        next.add(target);
                    }
                }
            }
            return new Transition(List.copyOf(next), terminate);
        }

        private RunResult cancelled() {
            persist(RunStatus.CANCELLED, null, null);
            logger.info("Session " + sessionId + " cancelled");
            return new RunResult.Cancelled(state);
        }

        /// A cancellation that arrived while the superstep ran wins over its failure.
        private RunResult fail(Throwable failure) {
            if (token.isCancelled()) {
                logger.fine("Session " + sessionId + " cancelled during a failing superstep: " + failure);
                return cancelled();
            }
            String message = failure.getMessage() != null
                    ? failure.getMessage()
                    : failure.getClass().getSimpleName();
            logger.severe("Session " + sessionId + " failed: " + message);
            persist(RunStatus.ERROR, null, message);
            return new RunResult.Failed(state, message, failure);
        }

        private void persist(RunStatus status, PendingInterrupt interrupt, String error) {
            Checkpoint checkpoint = new Checkpoint(
                    sessionId,
                    sequence++,
                    state,
                    frontier,
                    barrier.snapshot(),
                    interrupt,
                    status,
                    error,
                    Instant.now());
            checkpointer.put(checkpoint);
            listener.onCheckpoint(checkpoint);
        }
    }

    private record Transition(List<String> frontier, boolean terminate) {}
}
