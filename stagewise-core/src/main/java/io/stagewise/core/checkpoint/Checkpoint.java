package io.stagewise.core.checkpoint;

import io.stagewise.core.interrupt.PendingInterrupt;
import io.stagewise.core.state.PipelineState;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Durable snapshot written after every superstep.
///
/// Holds everything needed to continue the run in another process: the merged state, the
/// nodes of the next superstep, partial join arrivals and, when suspended, the pending
/// interrupt.
///
/// @param sessionId session the checkpoint belongs to, not null
/// @param sequence monotonically increasing number within the session
/// @param state pipeline state after the superstep, not null
/// @param nextNodes nodes to run in the next superstep, never null
/// @param barrierArrivals join id to upstream nodes that already arrived, never null
/// @param pendingInterrupt outstanding suspension, null unless waiting for input
/// @param status run status, not null
/// @param error error summary, null unless status is ERROR
/// @param createdAt write time, not null
public record Checkpoint(
        String sessionId,
        long sequence,
        PipelineState state,
        List<String> nextNodes,
        Map<String, List<String>> barrierArrivals,
        PendingInterrupt pendingInterrupt,
        RunStatus status,
        String error,
        Instant createdAt) {

    public Checkpoint {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        nextNodes = nextNodes != null ? List.copyOf(nextNodes) : List.of();
        Map<String, List<String>> arrivals = new LinkedHashMap<>();
        if (barrierArrivals != null) {
            barrierArrivals.forEach((k, v) -> arrivals.put(k, List.copyOf(v)));
        }
        barrierArrivals = Collections.unmodifiableMap(arrivals);
        if (status == RunStatus.WAITING_FOR_INPUT && pendingInterrupt == null) {
            throw new IllegalArgumentException("WAITING_FOR_INPUT checkpoint requires a pending interrupt");
        }
    }

    /// Returns a copy with a different status, keeping state and position.
    ///
    /// @param newStatus status of the copy, not null
    /// @param newSequence sequence of the copy
    /// @param error error summary, may be null
    /// @return the copy, never null
    public Checkpoint withStatus(RunStatus newStatus, long newSequence, String error) {
        return new Checkpoint(
                sessionId,
                newSequence,
                state,
                nextNodes,
                barrierArrivals,
                newStatus == RunStatus.WAITING_FOR_INPUT ? pendingInterrupt : null,
                newStatus,
                error,
                Instant.now());
    }
}
