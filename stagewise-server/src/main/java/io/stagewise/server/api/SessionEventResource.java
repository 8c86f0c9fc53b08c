package io.stagewise.server.api;

import io.smallrye.mutiny.Multi;
import io.stagewise.core.session.SessionInfo;
import io.stagewise.server.service.SessionService;
import io.stagewise.server.streaming.SessionEvent;
import io.stagewise.server.streaming.SessionEventBroadcaster;
import io.stagewise.server.validation.LogSanitizer;
import io.stagewise.server.validation.ValidSessionId;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Optional;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestStreamElementType;

/// SSE endpoint for streaming session events.
///
/// ### Usage
/// ```javascript
/// const events = new EventSource('/api/v1/sessions/s-1/events');
/// events.onmessage = (e) => {
///     const event = JSON.parse(e.data);
///     if (event.type === 'progress') console.log(event.onelineMessage);
///     if (event.type === 'input.required') askUser(event.content);
///     if (event.type === 'session.completed') render(event.content);
/// };
/// ```
///
/// A client that connects while the session is at rest (waiting, finished or failed)
/// receives the event that ended the latest run right away. Waiting sessions keep the stream
/// open for the events of the next run; finished sessions complete it.
///
/// @see SessionEventBroadcaster for event publishing
/// @see SessionEvent for the payloads
@Path("/api/v1/sessions")
public class SessionEventResource {

    private static final Logger LOG = Logger.getLogger(SessionEventResource.class);

    private final SessionEventBroadcaster broadcaster;
    private final SessionService sessionService;

    @Inject
    public SessionEventResource(SessionEventBroadcaster broadcaster, SessionService sessionService) {
        this.broadcaster = broadcaster;
        this.sessionService = sessionService;
    }

    @GET
    @Path("/{sessionId}/events")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<SessionEvent> streamEvents(@PathParam("sessionId") @ValidSessionId String sessionId) {
        LOG.infov("SSE subscription: sessionId={0}", LogSanitizer.sanitize(sessionId));

        Optional<SessionEvent> resting = restingEvent(sessionId);
        if (resting.isPresent() && resting.get().terminal()) {
            return Multi.createFrom().item(resting.get());
        }
        Multi<SessionEvent> live = broadcaster.subscribe(sessionId);
        Multi<SessionEvent> stream = resting.isPresent()
                ? Multi.createBy().concatenating().streams(Multi.createFrom().item(resting.get()), live)
                : live;
        return stream.onTermination().invoke((failure, cancelled) -> {
            if (failure != null) {
                LOG.warnv(failure, "SSE stream error for session: {0}", sessionId);
            } else if (cancelled) {
                LOG.debugv("SSE stream cancelled for session: {0}", sessionId);
            } else {
                LOG.debugv("SSE stream completed for session: {0}", sessionId);
            }
        });
    }

    private Optional<SessionEvent> restingEvent(String sessionId) {
        if (sessionService.isRunning(sessionId)) {
            return Optional.empty();
        }
        SessionInfo info = sessionService.status(sessionId);
        return SessionEvent.fromStatus(info);
    }
}
