package io.stagewise.core.execution;

import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.interrupt.InterruptController;

/// {@link NodeContext} backed by the executor's listener and the superstep's interrupt slot.
final class DefaultNodeContext implements NodeContext {

    private final String sessionId;
    private final String nodeId;
    private final int attempt;
    private final ExecutionListener listener;
    private final InterruptController.Slot slot;

    DefaultNodeContext(
            String sessionId,
            String nodeId,
            int attempt,
            ExecutionListener listener,
            InterruptController.Slot slot) {
        this.sessionId = sessionId;
        this.nodeId = nodeId;
        this.attempt = attempt;
        this.listener = listener;
        this.slot = slot;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public void progress(String message) {
        listener.onProgress(sessionId, message);
    }

    @Override
    public void stageStarted(int stageOrder) {
        listener.onStageStarted(sessionId, stageOrder);
    }

    @Override
    public String suspend(String message) {
        return slot.suspend(message);
    }
}
