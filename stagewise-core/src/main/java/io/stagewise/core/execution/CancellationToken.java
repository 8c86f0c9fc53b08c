package io.stagewise.core.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation flag checked by the executor between supersteps.
public final class CancellationToken {

    public static final CancellationToken NEVER = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (this == NEVER) {
            throw new UnsupportedOperationException("NEVER token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
