package io.stagewise.core.graph;

import java.io.Serial;

/// Thrown when a graph is built or routed inconsistently: unknown nodes, missing edges or
/// arrivals at a join from a node that is not one of its declared branches.
public class GraphDefinitionException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4213907651293018731L;

    public GraphDefinitionException(String message) {
        super(message);
    }
}
