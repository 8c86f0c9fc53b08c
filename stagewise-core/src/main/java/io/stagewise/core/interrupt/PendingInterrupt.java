package io.stagewise.core.interrupt;

import java.time.Instant;
import java.util.Objects;

/// An outstanding suspension waiting for an external value.
///
/// @param nodeId fully qualified id of the suspended node, not null
/// @param message payload surfaced to the caller, not null
/// @param createdAt when the node suspended, not null
public record PendingInterrupt(String nodeId, String message, Instant createdAt) {

    public PendingInterrupt {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}
