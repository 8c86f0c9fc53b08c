package io.stagewise.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.session.PipelineEvent;
import io.stagewise.core.session.SessionInfo;
import io.stagewise.server.service.SessionService;
import io.stagewise.server.streaming.SessionEvent;
import io.stagewise.server.streaming.SessionEventBroadcaster;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionEventResourceTest {

    private SessionEventBroadcaster broadcaster;
    private SessionService sessionService;
    private SessionEventResource resource;

    @BeforeEach
    void setUp() {
        broadcaster = new SessionEventBroadcaster();
        sessionService = mock(SessionService.class);
        resource = new SessionEventResource(broadcaster, sessionService);
    }

    @Test
    void shouldStreamLiveEventsOfRunningSession() {
        when(sessionService.isRunning("s-1")).thenReturn(true);

        AssertSubscriber<SessionEvent> subscriber =
                resource.streamEvents("s-1").subscribe().withSubscriber(AssertSubscriber.create(10));
        broadcaster.publish(new PipelineEvent.Progress("s-1", "Executing the code..."));
        broadcaster.publish(new PipelineEvent.Completed("s-1", "report"));

        subscriber.awaitCompletion();
        assertThat(subscriber.getItems())
                .extracting(SessionEvent::type)
                .containsExactly("progress", "session.completed");
    }

    @Test
    void shouldReplayFinalReportOfCompletedSession() {
        when(sessionService.isRunning("s-1")).thenReturn(false);
        when(sessionService.status("s-1")).thenReturn(info(RunStatus.COMPLETED, null, "final report"));

        AssertSubscriber<SessionEvent> subscriber =
                resource.streamEvents("s-1").subscribe().withSubscriber(AssertSubscriber.create(10));

        subscriber.awaitCompletion();
        assertThat(subscriber.getItems()).hasSize(1);
        assertThat(((SessionEvent.Completed) subscriber.getItems().get(0)).content()).isEqualTo("final report");
        assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
    }

    @Test
    void shouldReplayPendingQuestionThenFollowNextRun() {
        when(sessionService.isRunning("s-1")).thenReturn(false);
        when(sessionService.status("s-1")).thenReturn(info(RunStatus.WAITING_FOR_INPUT, "Which city?", null));

        AssertSubscriber<SessionEvent> subscriber =
                resource.streamEvents("s-1").subscribe().withSubscriber(AssertSubscriber.create(10));
        subscriber.awaitItems(1);
        broadcaster.publish(new PipelineEvent.StageStarted("s-1", 2));

        subscriber.awaitItems(2);
        assertThat(subscriber.getItems())
                .extracting(SessionEvent::type)
                .containsExactly("input.required", "stage.started");
        subscriber.assertNotTerminated();
    }

    @Test
    void shouldReleaseStreamWhenClientLeavesUnansweredQuestion() {
        when(sessionService.isRunning("s-1")).thenReturn(false);
        when(sessionService.status("s-1")).thenReturn(info(RunStatus.WAITING_FOR_INPUT, "Which city?", null));

        AssertSubscriber<SessionEvent> subscriber =
                resource.streamEvents("s-1").subscribe().withSubscriber(AssertSubscriber.create(10));
        subscriber.awaitItems(1);
        assertThat(broadcaster.hasSubscribers("s-1")).isTrue();

        subscriber.cancel();

        assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
    }

    private static SessionInfo info(RunStatus status, String pending, String report) {
        return new SessionInfo("s-1", status, 1, pending, report, null, 5, Instant.now());
    }
}
