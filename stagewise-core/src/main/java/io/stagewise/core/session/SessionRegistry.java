package io.stagewise.core.session;

import io.stagewise.core.execution.CancellationToken;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/// Process-wide registry of sessions with a call in flight.
///
/// A session is active from {@link #acquire} until {@link #release}; at most one call per
/// session is active at a time. All operations take a single lock.
///
/// ### Lifecycle
/// The registry accepts sessions until {@link #close()}. Closing cancels every active session;
/// their runs stop at the next superstep boundary.
public final class SessionRegistry implements AutoCloseable {

    private final Object lock = new Object();
    private final Map<String, CancellationToken> active = new HashMap<>();
    private boolean closed;

    /// Marks a session active and returns its cancellation token.
    ///
    /// @param sessionId session id, not null
    /// @return a fresh token for this call, never null
    /// @throws SessionStateException if the session already has a call in flight or the
    ///     registry is closed
    public CancellationToken acquire(String sessionId) {
        synchronized (lock) {
            if (closed) {
                throw new SessionStateException("Session registry is closed");
            }
            if (active.containsKey(sessionId)) {
                throw new SessionStateException("Session " + sessionId + " is already running");
            }
            CancellationToken token = new CancellationToken();
            active.put(sessionId, token);
            return token;
        }
    }

    public void release(String sessionId) {
        synchronized (lock) {
            active.remove(sessionId);
        }
    }

    /// Requests cancellation of an active session.
    ///
    /// @param sessionId session id, not null
    /// @return true if the session was active
    public boolean cancel(String sessionId) {
        synchronized (lock) {
            CancellationToken token = active.get(sessionId);
            if (token == null) {
                return false;
            }
            token.cancel();
            return true;
        }
    }

    public boolean isActive(String sessionId) {
        synchronized (lock) {
            return active.containsKey(sessionId);
        }
    }

    public Set<String> activeSessions() {
        synchronized (lock) {
            return Set.copyOf(active.keySet());
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            active.values().forEach(CancellationToken::cancel);
        }
    }
}
