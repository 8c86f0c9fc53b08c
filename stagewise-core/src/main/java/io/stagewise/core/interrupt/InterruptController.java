package io.stagewise.core.interrupt;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/// Hands resume values to suspended nodes and raises suspensions for new ones.
///
/// One controller serves one superstep. It holds the resume value for the node that was
/// suspended when the superstep was last attempted; each node invocation gets its own
/// {@link Slot} so that a retried invocation sees the value again.
///
/// ### Contracts
/// - A node receives its resume value from the first `suspend` call of an invocation
/// - Calling `suspend` again in the same invocation after consuming the value is a usage error
public final class InterruptController {

    private static final InterruptController NONE = new InterruptController(Map.of());

    private final Map<String, String> resumeValues;

    private InterruptController(Map<String, String> resumeValues) {
        this.resumeValues = Map.copyOf(resumeValues);
    }

    /// Controller for a superstep that carries no resume value.
    public static InterruptController none() {
        return NONE;
    }

    /// Controller delivering a resume value to the node that suspended.
    ///
    /// @param nodeId fully qualified id of the suspended node, not null
    /// @param value resume value, not null
    /// @return controller, never null
    public static InterruptController resuming(String nodeId, String value) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return new InterruptController(Map.of(nodeId, value));
    }

    /// Opens a slot for one invocation of a node.
    ///
    /// @param nodeId fully qualified node id, not null
    /// @return fresh slot, never null
    public Slot slotFor(String nodeId) {
        return new Slot(nodeId, resumeValues.get(nodeId));
    }

    /// Per-invocation suspend state.
    public static final class Slot {

        private final String nodeId;
        private final String resumeValue;
        private final AtomicBoolean consumed = new AtomicBoolean();

        private Slot(String nodeId, String resumeValue) {
            this.nodeId = nodeId;
            this.resumeValue = resumeValue;
        }

        /// Returns the resume value, or suspends the invocation.
        ///
        /// @param message payload for the caller, not null
        /// @return the resume value
        /// @throws SuspendSignal when no resume value is available
        /// @throws IllegalStateException when the resume value was already consumed
        public String suspend(String message) {
            Objects.requireNonNull(message, "message must not be null");
            if (resumeValue != null) {
                if (!consumed.compareAndSet(false, true)) {
                    throw new IllegalStateException(
                            "Node '" + nodeId + "' suspended twice in one invocation");
                }
                return resumeValue;
            }
            throw new SuspendSignal(nodeId, message);
        }
    }
}
