package io.stagewise.core.interrupt;

import java.io.Serial;
import java.time.Instant;

/// Unwinds a node invocation that asked to suspend.
///
/// Thrown by {@link InterruptController#suspend}; caught by the executor, never retried.
public final class SuspendSignal extends RuntimeException {

    @Serial private static final long serialVersionUID = 2960118735403519244L;

    private final transient PendingInterrupt interrupt;

    public SuspendSignal(String nodeId, String message) {
        super("Node '" + nodeId + "' suspended", null, false, false);
        this.interrupt = new PendingInterrupt(nodeId, message, Instant.now());
    }

    public PendingInterrupt interrupt() {
        return interrupt;
    }
}
