package io.stagewise.server.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.stagewise.core.session.PipelineEvent;
import io.stagewise.core.session.SessionInfo;
import java.time.Instant;
import java.util.Optional;

/// SSE event DTOs for session streaming.
///
/// Each {@link PipelineEvent} maps to one DTO; the `type()` value is used as the SSE event
/// name and is also written into the JSON payload.
///
/// ### Event Types
/// - `progress` - one-line message from the running stage
/// - `stage.started` - a stage began
/// - `input.required` - the session waits for an answer
/// - `session.completed` - the final report is ready
/// - `session.failed` - the run stopped on an error
/// - `session.cancelled` - the session was cancelled
///
/// @see SessionEventBroadcaster for event publishing
/// @see io.stagewise.server.api.SessionEventResource for the SSE endpoint
public sealed interface SessionEvent {

    @JsonProperty("type")
    String type();

    String sessionId();

    Instant timestamp();

    /// Whether the session will publish nothing further without a new request.
    default boolean terminal() {
        return false;
    }

    record Progress(String sessionId, String onelineMessage, Instant timestamp) implements SessionEvent {

        @Override
        public String type() {
            return "progress";
        }
    }

    record StageStarted(String sessionId, int currentStep, Instant timestamp) implements SessionEvent {

        @Override
        public String type() {
            return "stage.started";
        }
    }

    record InputRequired(String sessionId, String summary, String content, boolean requiresInput, Instant timestamp)
            implements SessionEvent {

        @Override
        public String type() {
            return "input.required";
        }
    }

    record Completed(String sessionId, String summary, String content, boolean completed, Instant timestamp)
            implements SessionEvent {

        @Override
        public String type() {
            return "session.completed";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record Failed(String sessionId, String summary, String content, Instant timestamp) implements SessionEvent {

        @Override
        public String type() {
            return "session.failed";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record Cancelled(String sessionId, String summary, Instant timestamp) implements SessionEvent {

        static final String SUMMARY = "Analysis Cancelled";

        @Override
        public String type() {
            return "session.cancelled";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    /// Converts a pipeline event into its SSE form.
    ///
    /// @param event the event, not null
    /// @return the DTO, never null
    static SessionEvent from(PipelineEvent event) {
        Instant now = Instant.now();
        if (event instanceof PipelineEvent.Progress e) {
            return new Progress(e.sessionId(), e.message(), now);
        }
        if (event instanceof PipelineEvent.StageStarted e) {
            return new StageStarted(e.sessionId(), e.stage(), now);
        }
        if (event instanceof PipelineEvent.InputRequired e) {
            return new InputRequired(e.sessionId(), PipelineEvent.InputRequired.PROMPT, e.message(), true, now);
        }
        if (event instanceof PipelineEvent.Completed e) {
            return new Completed(
                    e.sessionId(), PipelineEvent.Completed.TITLE, Optional.ofNullable(e.finalReport()).orElse(""), true, now);
        }
        if (event instanceof PipelineEvent.Failed e) {
            return new Failed(e.sessionId(), "Error", e.message(), now);
        }
        return new Cancelled(event.sessionId(), Cancelled.SUMMARY, now);
    }

    /// Rebuilds the event that ended the latest run of a session, for subscribers that
    /// connect after it was published.
    ///
    /// @param info session status, not null
    /// @return the event, or empty while the session is running
    static Optional<SessionEvent> fromStatus(SessionInfo info) {
        Instant at = info.updatedAt();
        return switch (info.status()) {
            case WAITING_FOR_INPUT -> Optional.of(new InputRequired(
                    info.sessionId(), PipelineEvent.InputRequired.PROMPT, info.pendingMessage(), true, at));
            case COMPLETED -> Optional.of(new Completed(
                    info.sessionId(),
                    PipelineEvent.Completed.TITLE,
                    Optional.ofNullable(info.finalReport()).orElse(""),
                    true,
                    at));
            case ERROR -> Optional.of(new Failed(
                    info.sessionId(), "Error", PipelineEvent.Failed.PREFIX + info.error(), at));
            case CANCELLED -> Optional.of(new Cancelled(info.sessionId(), Cancelled.SUMMARY, at));
            case RUNNING -> Optional.empty();
        };
    }
}
