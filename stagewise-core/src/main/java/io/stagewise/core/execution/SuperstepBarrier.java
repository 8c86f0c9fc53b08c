package io.stagewise.core.execution;

import io.stagewise.core.graph.Graph;
import io.stagewise.core.graph.GraphDefinitionException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Tracks which upstream branches have routed to each join node.
///
/// Arrivals survive across supersteps and checkpoints, so a join declared over branches that
/// finish in different supersteps still waits for all of them.
final class SuperstepBarrier {

    private final Map<String, Set<String>> arrivals = new LinkedHashMap<>();

    static SuperstepBarrier restore(Map<String, List<String>> snapshot) {
        SuperstepBarrier barrier = new SuperstepBarrier();
        snapshot.forEach((join, from) -> barrier.arrivals.put(join, new LinkedHashSet<>(from)));
        return barrier;
    }

    /// Records an arrival.
    ///
    /// @return true when every declared branch has now arrived; the join is then reset
    /// @throws GraphDefinitionException if `from` is not a declared branch of the join
    boolean arrive(Graph graph, String joinId, String from) {
        List<String> upstream = graph.joinUpstream(joinId);
        if (!upstream.contains(from)) {
            throw new GraphDefinitionException(
                    "Node '" + from + "' is not a declared branch of join '" + joinId + "'");
        }
        Set<String> arrived = arrivals.computeIfAbsent(joinId, k -> new LinkedHashSet<>());
        arrived.add(from);
        if (arrived.containsAll(upstream)) {
            arrivals.remove(joinId);
            return true;
        }
        return false;
    }

    Map<String, List<String>> snapshot() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        arrivals.forEach((join, from) -> copy.put(join, new ArrayList<>(from)));
        return copy;
    }
}
