package io.stagewise.core.session;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.Stage;
import java.time.Instant;

/// Read-only view of a session built from its latest checkpoint.
///
/// @param sessionId session id, not null
/// @param status run status, not null
/// @param currentStage order of the first open stage, 0 when every stage is completed
/// @param pendingMessage question waiting for an answer, null unless waiting for input
/// @param finalReport final report, null until written
/// @param error error summary, null unless the run failed
/// @param checkpointSequence sequence of the checkpoint this view was built from
/// @param updatedAt time of that checkpoint, not null
public record SessionInfo(
        String sessionId,
        RunStatus status,
        int currentStage,
        String pendingMessage,
        String finalReport,
        String error,
        long checkpointSequence,
        Instant updatedAt) {

    public static SessionInfo from(Checkpoint checkpoint) {
        PipelineState state = checkpoint.state();
        return new SessionInfo(
                checkpoint.sessionId(),
                checkpoint.status(),
                state.currentStage().map(Stage::order).orElse(0),
                checkpoint.pendingInterrupt() != null ? checkpoint.pendingInterrupt().message() : null,
                state.finalReport(),
                checkpoint.error(),
                checkpoint.sequence(),
                checkpoint.createdAt());
    }
}
