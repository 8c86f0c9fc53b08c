package io.stagewise.server.streaming;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import io.stagewise.core.session.PipelineEvent;
import io.stagewise.core.session.PipelineEventSink;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/// Broadcasts session events to SSE subscribers.
///
/// Keeps one Mutiny {@link BroadcastProcessor} per session. Implements
/// {@link PipelineEventSink} so the runner publishes straight into it; events are converted
/// to {@link SessionEvent} DTOs on the way.
///
/// ### Memory Management
/// A session's processor is registered by its first subscription. It is completed and removed
/// when a terminal event (completed, failed, cancelled) is published or on
/// {@link #complete(String)}, and removed when its last subscriber cancels, so a session left
/// waiting for input does not hold a processor once its clients are gone. Events for sessions
/// nobody subscribed to are dropped.
///
/// @implNote Thread-safe. Publishing happens on executor threads, including fan-out workers.
///
/// @see io.stagewise.server.api.SessionEventResource for the SSE endpoint
@ApplicationScoped
public class SessionEventBroadcaster implements PipelineEventSink {

    private static final Logger LOG = Logger.getLogger(SessionEventBroadcaster.class);

    private final Map<String, SessionStream> streams = new ConcurrentHashMap<>();

    /// Subscribes to events of a session.
    ///
    /// The session's processor is looked up, or created, when the returned stream is
    /// subscribed to.
    ///
    /// @param sessionId the session, not null
    /// @return event stream, completes after the session's terminal event
    public Multi<SessionEvent> subscribe(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return Multi.createFrom().deferred(() -> {
            SessionStream stream = acquire(sessionId);
            return stream.processor().onCancellation().invoke(() -> {
                LOG.debugv("Client disconnected from session: {0}", sessionId);
                release(sessionId, stream);
            });
        });
    }

    private SessionStream acquire(String sessionId) {
        return streams.compute(sessionId, (id, existing) -> {
            SessionStream stream = existing;
            if (stream == null) {
                LOG.debugv("Creating broadcast processor for session: {0}", id);
                stream = new SessionStream(BroadcastProcessor.create(), new AtomicInteger());
            }
            stream.subscribers().incrementAndGet();
            return stream;
        });
    }

    private void release(String sessionId, SessionStream stream) {
        streams.computeIfPresent(sessionId, (id, current) -> {
            if (current != stream || current.subscribers().decrementAndGet() > 0) {
                return current;
            }
            LOG.debugv("Last subscriber left session {0}, dropping its processor", id);
            return null;
        });
    }

    @Override
    public void publish(PipelineEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        publish(SessionEvent.from(event));
    }

    /// Publishes a DTO to the subscribers of its session.
    ///
    /// @param event the event, not null
    public void publish(SessionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String sessionId = event.sessionId();
        SessionStream stream = streams.get(sessionId);
        if (stream == null) {
            LOG.tracev("No subscribers for session {0}, event {1} dropped", sessionId, event.type());
            return;
        }
        LOG.debugv("Publishing {0} to session {1}", event.type(), sessionId);
        stream.processor().onNext(event);
        if (event.terminal()) {
            complete(sessionId);
        }
    }

    /// Completes and removes the event stream of a session.
    ///
    /// @param sessionId the session, not null
    public void complete(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        SessionStream stream = streams.remove(sessionId);
        if (stream != null) {
            LOG.debugv("Completing broadcast for session: {0}", sessionId);
            stream.processor().onComplete();
        }
    }

    public int activeSubscriptionCount() {
        return streams.size();
    }

    public boolean hasSubscribers(String sessionId) {
        return streams.containsKey(sessionId);
    }

    private record SessionStream(BroadcastProcessor<SessionEvent> processor, AtomicInteger subscribers) {}
}
