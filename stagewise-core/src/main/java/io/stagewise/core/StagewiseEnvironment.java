package io.stagewise.core;

import io.stagewise.core.checkpoint.Checkpointer;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.session.PipelineRunner;
import io.stagewise.core.session.SessionRegistry;
import java.util.concurrent.ExecutorService;

/// Container holding the wired components of a stagewise installation.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent reads. {@link #close()} cancels running sessions and shuts
/// down both thread pools without waiting.
///
/// @apiNote Create instances via {@link StagewiseFactory#builder()}.
public final class StagewiseEnvironment implements AutoCloseable {

    private final PipelineRunner runner;
    private final PipelineDefinition definition;
    private final Graph graph;
    private final Checkpointer checkpointer;
    private final SessionRegistry sessionRegistry;
    private final ExecutorService nodeExecutor;
    private final ExecutorService sessionExecutor;

    public StagewiseEnvironment(
            PipelineRunner runner,
            PipelineDefinition definition,
            Graph graph,
            Checkpointer checkpointer,
            SessionRegistry sessionRegistry,
            ExecutorService nodeExecutor,
            ExecutorService sessionExecutor) {
        this.runner = runner;
        this.definition = definition;
        this.graph = graph;
        this.checkpointer = checkpointer;
        this.sessionRegistry = sessionRegistry;
        this.nodeExecutor = nodeExecutor;
        this.sessionExecutor = sessionExecutor;
    }

    public PipelineRunner getRunner() {
        return runner;
    }

    /// Returns the stage definitions after configuration overrides.
    ///
    /// @return the definition, never null
    public PipelineDefinition getDefinition() {
        return definition;
    }

    public Graph getGraph() {
        return graph;
    }

    public Checkpointer getCheckpointer() {
        return checkpointer;
    }

    public SessionRegistry getSessionRegistry() {
        return sessionRegistry;
    }

    @Override
    public void close() {
        sessionRegistry.close();
        sessionExecutor.shutdown();
        nodeExecutor.shutdown();
    }
}
