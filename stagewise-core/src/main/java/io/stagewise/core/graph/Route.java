package io.stagewise.core.graph;

import java.util.List;
import java.util.Objects;

/// Routing decision returned by a node, resolved by the executor against the {@link Graph}.
///
/// - {@link Next}: follow the statically declared edge
/// - {@link Goto}: jump to a node computed at runtime
/// - {@link FanOut}: run several nodes concurrently in the next superstep
/// - {@link End}: leave the current sub-graph
/// - {@link Terminate}: finish the whole run
///
/// Targets are node ids relative to the routing node's scope; see {@link Graph#resolve}.
public sealed interface Route {

    record Next() implements Route {}

    record Goto(String target) implements Route {
        public Goto {
            Objects.requireNonNull(target, "target must not be null");
        }
    }

    record FanOut(List<String> targets) implements Route {
        public FanOut {
            Objects.requireNonNull(targets, "targets must not be null");
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("FanOut requires at least one target");
            }
            targets = List.copyOf(targets);
        }
    }

    record End() implements Route {}

    record Terminate() implements Route {}
}
