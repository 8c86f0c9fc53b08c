package io.stagewise.core.execution;

import java.io.Serial;

/// Thrown by a node to abort the run without retrying.
public class FatalNodeException extends RuntimeException {

    @Serial private static final long serialVersionUID = 7755109203668014952L;

    public FatalNodeException(String message) {
        super(message);
    }

    public FatalNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
