package io.stagewise.server.service;

import io.stagewise.core.StagewiseEnvironment;
import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.execution.RunResult;
import io.stagewise.core.session.PipelineEvent;
import io.stagewise.core.session.PipelineRequest;
import io.stagewise.core.session.PipelineRunner;
import io.stagewise.core.session.SessionInfo;
import io.stagewise.core.session.SessionNotFoundException;
import io.stagewise.core.session.SessionStateException;
import io.stagewise.server.streaming.SessionEventBroadcaster;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Session operations behind the REST API.
///
/// Checks session state synchronously, so callers get 404/409 responses right away, then
/// dispatches the run to the runner's session executor. Progress and outcomes reach clients
/// through {@link SessionEventBroadcaster}.
///
/// @see io.stagewise.server.api.PipelineResource for the REST endpoints
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final PipelineRunner runner;
    private final SessionEventBroadcaster broadcaster;

    /// Sessions whose start call has not returned yet; covers the gap before the first checkpoint.
    private final Set<String> dispatched = ConcurrentHashMap.newKeySet();

    @Inject
    public SessionService(StagewiseEnvironment environment, SessionEventBroadcaster broadcaster) {
        this(environment.getRunner(), broadcaster);
    }

    SessionService(PipelineRunner runner, SessionEventBroadcaster broadcaster) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster must not be null");
    }

    /// Starts a new session in the background.
    ///
    /// @param request run input, not null
    /// @return the new session id, never null
    public String startSession(PipelineRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String sessionId = newSessionId();
        LOG.infov("Starting session {0} with {1} artifacts", sessionId, request.artifacts().size());
        dispatched.add(sessionId);
        track(sessionId, "start", runner.start(sessionId, request, broadcaster));
        return sessionId;
    }

    /// Answers a session that waits for input. A quit word cancels it instead.
    ///
    /// @param sessionId session id, not null
    /// @param input the answer, not null
    /// @return true if the input was a quit word
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionStateException if the session is not waiting for input
    public boolean respond(String sessionId, String input) {
        Objects.requireNonNull(input, "input must not be null");
        SessionInfo info = requireIdle(sessionId);
        if (info.status() != RunStatus.WAITING_FOR_INPUT) {
            throw new SessionStateException(
                    "Session " + sessionId + " is not waiting for input (status " + info.status() + ")");
        }
        boolean quit = PipelineRunner.isQuitWord(input);
        track(sessionId, "respond", runner.respond(sessionId, input, broadcaster));
        return quit;
    }

    /// Continues a session that crashed mid-run or stopped on an error.
    ///
    /// @param sessionId session id, not null
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionStateException if the session is running, waiting or finished
    public void recover(String sessionId) {
        SessionInfo info = requireIdle(sessionId);
        if (info.status() != RunStatus.RUNNING && info.status() != RunStatus.ERROR) {
            throw new SessionStateException(
                    "Session " + sessionId + " cannot be recovered from status " + info.status());
        }
        LOG.infov("Recovering session {0} from checkpoint {1}", sessionId, info.checkpointSequence());
        track(sessionId, "recover", runner.recoverAsync(sessionId, broadcaster));
    }

    /// Cancels a session.
    ///
    /// @param sessionId session id, not null
    /// @return true if the session was running or resting and is now cancelled
    /// @throws SessionNotFoundException if the session does not exist
    public boolean cancel(String sessionId) {
        return runner.cancel(sessionId, broadcaster);
    }

    /// Returns the session status; a session dispatched but not yet checkpointed reads as
    /// running.
    ///
    /// @throws SessionNotFoundException if the session does not exist
    public SessionInfo status(String sessionId) {
        Optional<SessionInfo> info = runner.status(sessionId);
        if (info.isEmpty() && dispatched.contains(sessionId)) {
            return new SessionInfo(sessionId, RunStatus.RUNNING, 0, null, null, null, -1, Instant.now());
        }
        return info.orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /// @throws SessionNotFoundException if the session does not exist
    public List<Checkpoint> history(String sessionId) {
        List<Checkpoint> history = runner.history(sessionId);
        if (history.isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return history;
    }

    /// Whether a run of the session is in flight, including a start not yet picked up.
    public boolean isRunning(String sessionId) {
        return dispatched.contains(sessionId) || runner.isRunning(sessionId);
    }

    private SessionInfo requireIdle(String sessionId) {
        SessionInfo info = status(sessionId);
        if (isRunning(sessionId)) {
            throw new SessionStateException("Session " + sessionId + " is already running");
        }
        return info;
    }

    private void track(String sessionId, String operation, CompletableFuture<RunResult> run) {
        run.whenComplete((result, error) -> {
            dispatched.remove(sessionId);
            if (error != null) {
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                if (cause instanceof SessionStateException) {
                    LOG.warnv("Session {0} {1} rejected: {2}", sessionId, operation, cause.getMessage());
                    return;
                }
                LOG.errorv(cause, "Session {0} {1} failed", sessionId, operation);
                broadcaster.publish(new PipelineEvent.Failed(sessionId, String.valueOf(cause.getMessage())));
            } else {
                LOG.infov("Session {0} {1} ended: {2}", sessionId, operation, result.getClass().getSimpleName());
            }
        });
    }

    static String newSessionId() {
        return "s-" + UUID.randomUUID();
    }
}
