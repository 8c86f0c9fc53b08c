package io.stagewise.core.graph;

import io.stagewise.core.execution.RetryPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable node registry with static edges, join declarations and nested scopes.
///
/// Sub-graphs are composed with {@link Builder#include}: every node of the sub-graph is
/// registered as `scope/id`, and an {@link Route.End} returned inside the scope continues at
/// the scope's exit target. Routing targets are resolved relative to the routing node's scope
/// first, then outward.
///
/// {@snippet :
/// Graph stage = Graph.builder("cleaning")
///         .node("agent", agentNode)
///         .node("execute", executeNode, RetryPolicy.noRetry())
///         .edge("execute", "agent")
///         .entry("agent")
///         .build();
///
/// Graph top = Graph.builder("pipeline")
///         .node("route_stage", router)
///         .include("stage_2", stage, "route_stage")
///         .entry("route_stage")
///         .build();
/// }
///
/// ### Contracts
/// - **Closed**: every edge, join branch and exit target names a registered node
/// - **Immutable**: a built graph never changes and is safe to share across threads
public final class Graph {

    static final String SEPARATOR = "/";

    private final String name;
    private final String entry;
    private final Map<String, Registration> nodes;
    private final Map<String, String> edges;
    private final Map<String, List<String>> joins;
    private final Map<String, String> exits;
    private final Map<String, String> scopeEntries;

    private Graph(Builder builder) {
        this.name = builder.name;
        this.entry = builder.entry;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = Map.copyOf(builder.edges);
        this.joins = Map.copyOf(builder.joins);
        this.exits = Map.copyOf(builder.exits);
        this.scopeEntries = Map.copyOf(builder.scopeEntries);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String entry() {
        return entry;
    }

    /// Returns the ids of every registered node in registration order.
    ///
    /// @return node ids, never null
    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    /// Returns the registration of a node.
    ///
    /// @param nodeId fully qualified node id, not null
    /// @return registration, never null
    /// @throws GraphDefinitionException if the node is unknown
    public Registration registration(String nodeId) {
        Registration registration = nodes.get(nodeId);
        if (registration == null) {
            throw new GraphDefinitionException("Unknown node '" + nodeId + "' in graph " + name);
        }
        return registration;
    }

    public Optional<String> staticNext(String nodeId) {
        return Optional.ofNullable(edges.get(nodeId));
    }

    /// Returns where {@link Route.End} continues for a node.
    ///
    /// @param nodeId fully qualified node id, not null
    /// @return the exit target, or empty when End finishes the run
    public Optional<String> exitFor(String nodeId) {
        return Optional.ofNullable(exits.get(nodeId));
    }

    public boolean isJoin(String nodeId) {
        return joins.containsKey(nodeId);
    }

    /// Returns the declared upstream branches of a join node.
    ///
    /// @param joinId fully qualified join id, not null
    /// @return upstream node ids in declared order, empty if the node is not a join
    public List<String> joinUpstream(String joinId) {
        return joins.getOrDefault(joinId, List.of());
    }

    /// Resolves a routing target named by a node.
    ///
    /// The target is looked up in the node's own scope, then in each enclosing scope. A target
    /// naming an included scope resolves to that scope's entry node.
    ///
    /// @param from fully qualified id of the routing node, not null
    /// @param target target as written by the node, not null
    /// @return fully qualified target id, never null
    /// @throws GraphDefinitionException if no scope knows the target
    public String resolve(String from, String target) {
        String scope = scopeOf(from);
        while (true) {
            String candidate = scope.isEmpty() ? target : scope + SEPARATOR + target;
            if (nodes.containsKey(candidate)) {
                return candidate;
            }
            String scoped = scopeEntries.get(candidate);
            if (scoped != null) {
                return scoped;
            }
            if (scope.isEmpty()) {
                throw new GraphDefinitionException(
                        "Node '" + from + "' routed to unknown target '" + target + "'");
            }
            scope = scopeOf(scope);
        }
    }

    /// Returns the scope portion of a qualified id, empty for top-level nodes.
    ///
    /// @param nodeId qualified node id, not null
    /// @return scope path, never null
    public static String scopeOf(String nodeId) {
        int idx = nodeId.lastIndexOf(SEPARATOR);
        return idx < 0 ? "" : nodeId.substring(0, idx);
    }

    /// Returns the unqualified portion of a node id.
    ///
    /// @param nodeId qualified node id, not null
    /// @return local id, never null
    public static String localId(String nodeId) {
        int idx = nodeId.lastIndexOf(SEPARATOR);
        return idx < 0 ? nodeId : nodeId.substring(idx + 1);
    }

    /// A registered node with its retry policy.
    ///
    /// @param id fully qualified id, not null
    /// @param node the node, not null
    /// @param retryPolicy retry policy, not null
    public record Registration(String id, Node node, RetryPolicy retryPolicy) {

        public Registration {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(node, "node must not be null");
            Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        }
    }

    public static final class Builder {

        private final String name;
        private String entry;
        private final Map<String, Registration> nodes = new LinkedHashMap<>();
        private final Map<String, String> edges = new HashMap<>();
        private final Map<String, List<String>> joins = new HashMap<>();
        private final Map<String, String> exits = new HashMap<>();
        private final Map<String, String> scopeEntries = new HashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        /// Registers a node with the default retry policy.
        public Builder node(String id, Node node) {
            return node(id, node, RetryPolicy.defaults());
        }

        public Builder node(String id, Node node, RetryPolicy retryPolicy) {
            Objects.requireNonNull(id, "id must not be null");
            if (id.contains(SEPARATOR)) {
                throw new GraphDefinitionException("Node id must not contain '/': " + id);
            }
            register(new Registration(id, node, retryPolicy));
            return this;
        }

        /// Declares the static edge followed by {@link Route.Next}.
        public Builder edge(String from, String to) {
            edges.put(from, to);
            return this;
        }

        public Builder entry(String id) {
            this.entry = id;
            return this;
        }

        /// Declares a join node that runs only after every upstream branch has routed to it.
        ///
        /// @param joinId the join node id, not null
        /// @param upstream branch node ids in merge order, not empty
        /// @return this builder
        public Builder join(String joinId, String... upstream) {
            if (upstream.length == 0) {
                throw new GraphDefinitionException("Join '" + joinId + "' needs upstream nodes");
            }
            joins.put(joinId, List.of(upstream));
            return this;
        }

        /// Includes a sub-graph under a scope.
        ///
        /// @param scope scope name, becomes the id prefix, not null
        /// @param subgraph the graph to include, not null
        /// @param exitTarget top-level node that {@link Route.End} continues at, or null to end
        ///     the run
        /// @return this builder
        public Builder include(String scope, Graph subgraph, String exitTarget) {
            Objects.requireNonNull(scope, "scope must not be null");
            Objects.requireNonNull(subgraph, "subgraph must not be null");
            String prefix = scope + SEPARATOR;
            for (Registration registration : subgraph.nodes.values()) {
                String id = prefix + registration.id();
                register(new Registration(id, registration.node(), registration.retryPolicy()));
                String nestedExit = subgraph.exits.get(registration.id());
                if (nestedExit != null) {
                    exits.put(id, prefix + nestedExit);
                } else if (exitTarget != null) {
                    exits.put(id, exitTarget);
                }
            }
            subgraph.edges.forEach((from, to) -> edges.put(prefix + from, prefix + to));
            subgraph.joins.forEach(
                    (join, upstream) -> {
                        List<String> prefixed = new ArrayList<>();
                        upstream.forEach(u -> prefixed.add(prefix + u));
                        joins.put(prefix + join, List.copyOf(prefixed));
                    });
            subgraph.scopeEntries.forEach((s, e) -> scopeEntries.put(prefix + s, prefix + e));
            scopeEntries.put(scope, prefix + subgraph.entry);
            return this;
        }

        private void register(Registration registration) {
            if (nodes.putIfAbsent(registration.id(), registration) != null) {
                throw new GraphDefinitionException("Duplicate node id: " + registration.id());
            }
        }

        public Graph build() {
            if (entry == null || !nodes.containsKey(entry)) {
                throw new GraphDefinitionException("Graph " + name + " has no valid entry node");
            }
            edges.forEach(
                    (from, to) -> {
                        requireNode(from, "edge source");
                        requireNode(to, "edge target");
                    });
            joins.forEach(
                    (join, upstream) -> {
                        requireNode(join, "join");
                        upstream.forEach(u -> requireNode(u, "join branch"));
                    });
            exits.values().forEach(target -> requireNode(target, "exit target"));
            return new Graph(this);
        }

        private void requireNode(String id, String role) {
            if (!nodes.containsKey(id)) {
                throw new GraphDefinitionException(
                        "Graph " + name + " references unknown " + role + " '" + id + "'");
            }
        }
    }
}
