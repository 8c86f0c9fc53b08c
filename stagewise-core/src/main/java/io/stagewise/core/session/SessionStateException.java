package io.stagewise.core.session;

import java.io.Serial;

/// The requested operation is not valid for the session's current status, for example a
/// resume of a session that is not waiting for input.
public class SessionStateException extends RuntimeException {

    @Serial private static final long serialVersionUID = -8871203746120950331L;

    public SessionStateException(String message) {
        super(message);
    }
}
