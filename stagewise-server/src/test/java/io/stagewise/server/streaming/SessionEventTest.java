package io.stagewise.server.streaming;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.session.PipelineEvent;
import io.stagewise.core.session.SessionInfo;
import io.stagewise.serialization.StateSerializer;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionEventTest {

    private static final Instant AT = Instant.parse("2026-01-15T10:00:00Z");

    @Nested
    class FromPipelineEvent {

        @Test
        void shouldMapStageStarted() {
            SessionEvent event = SessionEvent.from(new PipelineEvent.StageStarted("s-1", 3));

            assertThat(event).isInstanceOf(SessionEvent.StageStarted.class);
            assertThat(((SessionEvent.StageStarted) event).currentStep()).isEqualTo(3);
            assertThat(event.terminal()).isFalse();
        }

        @Test
        void shouldMapInputRequiredWithPrompt() {
            SessionEvent.InputRequired event = (SessionEvent.InputRequired)
                    SessionEvent.from(new PipelineEvent.InputRequired("s-1", "Please clarify."));

            assertThat(event.summary()).isEqualTo(PipelineEvent.InputRequired.PROMPT);
            assertThat(event.content()).isEqualTo("Please clarify.");
            assertThat(event.requiresInput()).isTrue();
        }

        @Test
        void shouldMapCompletedAsTerminal() {
            SessionEvent.Completed event = (SessionEvent.Completed)
                    SessionEvent.from(new PipelineEvent.Completed("s-1", "report"));

            assertThat(event.summary()).isEqualTo(PipelineEvent.Completed.TITLE);
            assertThat(event.content()).isEqualTo("report");
            assertThat(event.completed()).isTrue();
            assertThat(event.terminal()).isTrue();
        }

        @Test
        void shouldMapFailedWithPrefixedMessage() {
            SessionEvent.Failed event =
                    (SessionEvent.Failed) SessionEvent.from(new PipelineEvent.Failed("s-1", "sandbox down"));

            assertThat(event.summary()).isEqualTo("Error");
            assertThat(event.content()).startsWith(PipelineEvent.Failed.PREFIX).endsWith("sandbox down");
        }

        @Test
        void shouldMapCancelled() {
            SessionEvent event = SessionEvent.from(new PipelineEvent.Cancelled("s-1"));

            assertThat(event.type()).isEqualTo("session.cancelled");
            assertThat(((SessionEvent.Cancelled) event).summary()).isEqualTo("Analysis Cancelled");
        }
    }

    @Nested
    class FromStatus {

        @Test
        void shouldReturnEmptyWhileRunning() {
            assertThat(SessionEvent.fromStatus(info(RunStatus.RUNNING, null, null, null))).isEmpty();
        }

        @Test
        void shouldRebuildPendingQuestion() {
            Optional<SessionEvent> event =
                    SessionEvent.fromStatus(info(RunStatus.WAITING_FOR_INPUT, "Which city?", null, null));

            assertThat(event).get().isInstanceOf(SessionEvent.InputRequired.class);
            assertThat(((SessionEvent.InputRequired) event.get()).content()).isEqualTo("Which city?");
            assertThat(event.get().timestamp()).isEqualTo(AT);
        }

        @Test
        void shouldRebuildFinalReport() {
            Optional<SessionEvent> event =
                    SessionEvent.fromStatus(info(RunStatus.COMPLETED, null, "final", null));

            assertThat(((SessionEvent.Completed) event.orElseThrow()).content()).isEqualTo("final");
        }

        @Test
        void shouldRebuildErrorAsFailure() {
            Optional<SessionEvent> event = SessionEvent.fromStatus(info(RunStatus.ERROR, null, null, "boom"));

            assertThat(event.orElseThrow().terminal()).isTrue();
            assertThat(((SessionEvent.Failed) event.get()).content()).endsWith("boom");
        }

        private SessionInfo info(RunStatus status, String pending, String report, String error) {
            return new SessionInfo("s-1", status, 2, pending, report, error, 7, AT);
        }
    }

    @Test
    void shouldWriteTypeIntoJson() throws Exception {
        ObjectMapper mapper = StateSerializer.createMapper();

        JsonNode json = mapper.valueToTree(new SessionEvent.StageStarted("s-1", 2, AT));

        assertThat(json.path("type").asText()).isEqualTo("stage.started");
        assertThat(json.path("sessionId").asText()).isEqualTo("s-1");
        assertThat(json.path("currentStep").asInt()).isEqualTo(2);
    }
}
