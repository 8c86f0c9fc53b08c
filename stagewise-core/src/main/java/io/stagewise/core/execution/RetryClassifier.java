package io.stagewise.core.execution;

/// Decides whether a node failure is transient.
@FunctionalInterface
public interface RetryClassifier {

    /// @param error the failure thrown by the node, not null
    /// @return true if the node should be invoked again
    boolean isRetryable(Throwable error);
}
