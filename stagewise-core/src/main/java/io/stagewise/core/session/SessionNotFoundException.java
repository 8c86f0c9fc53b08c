package io.stagewise.core.session;

import java.io.Serial;

/// No session (and no checkpoint) exists for the given id.
public class SessionNotFoundException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3385120489263011254L;

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
