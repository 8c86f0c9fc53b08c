package io.stagewise.server.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.stagewise.core.session.PipelineEvent;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionEventBroadcasterTest {

    private SessionEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new SessionEventBroadcaster();
    }

    @Nested
    class Subscribe {

        @Test
        void shouldCreateSubscriptionForSession() {
            listen("s-1");

            assertThat(broadcaster.hasSubscribers("s-1")).isTrue();
        }

        @Test
        void shouldNotRegisterUntilSubscribed() {
            broadcaster.subscribe("s-1");

            assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
        }

        @Test
        void shouldReuseExistingProcessorForSameSession() {
            listen("s-1");
            listen("s-1");

            assertThat(broadcaster.activeSubscriptionCount()).isEqualTo(1);
        }

        @Test
        void shouldDropProcessorWhenLastSubscriberCancels() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");
            broadcaster.publish(new PipelineEvent.InputRequired("s-1", "Which city?"));
            subscriber.awaitItems(1);

            subscriber.cancel();

            assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
            assertThat(broadcaster.activeSubscriptionCount()).isZero();
        }

        @Test
        void shouldKeepProcessorWhileOtherSubscribersRemain() {
            AssertSubscriber<SessionEvent> leaving = listen("s-1");
            AssertSubscriber<SessionEvent> staying = listen("s-1");

            leaving.cancel();
            broadcaster.publish(new PipelineEvent.Progress("s-1", "still here"));

            staying.awaitItems(1);
            assertThat(broadcaster.hasSubscribers("s-1")).isTrue();
            assertThat(leaving.getItems()).isEmpty();
        }

        @Test
        void shouldStartFreshProcessorAfterReconnect() {
            listen("s-1").cancel();

            AssertSubscriber<SessionEvent> reconnected = listen("s-1");
            broadcaster.publish(new PipelineEvent.StageStarted("s-1", 2));

            reconnected.awaitItems(1);
            reconnected.assertNotTerminated();
        }
    }

    @Nested
    class Publish {

        @Test
        void shouldConvertPipelineEventsForSubscribers() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");

            broadcaster.publish(new PipelineEvent.Progress("s-1", "Code is generated."));

            subscriber.awaitItems(1);
            SessionEvent event = subscriber.getItems().get(0);
            assertThat(event.type()).isEqualTo("progress");
            assertThat(((SessionEvent.Progress) event).onelineMessage()).isEqualTo("Code is generated.");
        }

        @Test
        void shouldDropEventsWhenNobodySubscribed() {
            assertThatCode(() -> broadcaster.publish(new PipelineEvent.StageStarted("s-1", 2)))
                    .doesNotThrowAnyException();
            assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
        }

        @Test
        void shouldDeliverEventsInOrder() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");

            broadcaster.publish(new PipelineEvent.StageStarted("s-1", 1));
            broadcaster.publish(new PipelineEvent.Progress("s-1", "Executing the code..."));
            broadcaster.publish(new PipelineEvent.InputRequired("s-1", "Is this objective fine?"));

            subscriber.awaitItems(3);
            assertThat(subscriber.getItems())
                    .extracting(SessionEvent::type)
                    .containsExactly("stage.started", "progress", "input.required");
        }

        @Test
        void shouldNotLeakEventsAcrossSessions() {
            AssertSubscriber<SessionEvent> first = listen("s-1");
            AssertSubscriber<SessionEvent> second = listen("s-2");

            broadcaster.publish(new PipelineEvent.Progress("s-2", "hello"));

            second.awaitItems(1);
            assertThat(first.getItems()).isEmpty();
        }
    }

    @Nested
    class Completion {

        @Test
        void shouldCompleteStreamOnTerminalEvent() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");

            broadcaster.publish(new PipelineEvent.Completed("s-1", "<stage_1>done</stage_1>"));

            subscriber.awaitCompletion();
            assertThat(subscriber.getItems()).hasSize(1);
            assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
        }

        @Test
        void shouldCompleteStreamOnFailure() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");

            broadcaster.publish(new SessionEvent.Failed("s-1", "Error", "boom", Instant.now()));

            subscriber.awaitCompletion();
            assertThat(broadcaster.activeSubscriptionCount()).isZero();
        }

        @Test
        void shouldKeepStreamOpenWhileWaitingForInput() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");

            broadcaster.publish(new PipelineEvent.InputRequired("s-1", "question"));

            subscriber.awaitItems(1);
            subscriber.assertNotTerminated();
            assertThat(broadcaster.hasSubscribers("s-1")).isTrue();
        }

        @Test
        void shouldCompleteExplicitly() {
            AssertSubscriber<SessionEvent> subscriber = listen("s-1");

            broadcaster.complete("s-1");

            subscriber.awaitCompletion();
            assertThat(broadcaster.hasSubscribers("s-1")).isFalse();
        }
    }

    private AssertSubscriber<SessionEvent> listen(String sessionId) {
        return broadcaster.subscribe(sessionId).subscribe().withSubscriber(AssertSubscriber.create(10));
    }
}
