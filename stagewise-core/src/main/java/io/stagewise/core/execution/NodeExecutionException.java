package io.stagewise.core.execution;

import java.io.Serial;

/// A node failed fatally, either on a non-retryable error or after exhausting its attempts.
public class NodeExecutionException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2390842231735917713L;

    private final String nodeId;
    private final int attempts;

    public NodeExecutionException(String nodeId, int attempts, Throwable cause) {
        super(
                "Node '"
                        + nodeId
                        + "' failed after "
                        + attempts
                        + (attempts == 1 ? " attempt: " : " attempts: ")
                        + cause.getMessage(),
                cause);
        this.nodeId = nodeId;
        this.attempts = attempts;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getAttempts() {
        return attempts;
    }
}
