package io.stagewise.core.execution;

import io.stagewise.core.graph.Command;
import io.stagewise.core.interrupt.PendingInterrupt;
import java.util.Objects;

/// Outcome of one node in a superstep.
///
/// Exactly one of `command`, `interrupt` or `failure` is set.
///
/// @param nodeId fully qualified node id, not null
/// @param command returned command on success
/// @param interrupt pending interrupt when the node suspended
/// @param failure fatal failure after retries
public record BranchResult(
        String nodeId, Command command, PendingInterrupt interrupt, Throwable failure) {

    public BranchResult {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
    }

    public static BranchResult success(String nodeId, Command command) {
        return new BranchResult(nodeId, Objects.requireNonNull(command), null, null);
    }

    public static BranchResult suspended(String nodeId, PendingInterrupt interrupt) {
        return new BranchResult(nodeId, null, Objects.requireNonNull(interrupt), null);
    }

    public static BranchResult failed(String nodeId, Throwable failure) {
        return new BranchResult(nodeId, null, null, Objects.requireNonNull(failure));
    }

    public boolean isSuccess() {
        return command != null;
    }

    public boolean isSuspended() {
        return interrupt != null;
    }

    public boolean isFailed() {
        return failure != null;
    }
}
