package com.netmotif.engine;

import com.netmotif.api.Value;

/**
 * What the checker knows about a value without computing it: its kind and,
 * for graphs, its exact node and edge counts.
 */
public record Shape(Value.Kind kind, long nodeCount, long edgeCount) {
    private static final Shape NODE_SET = new Shape(Value.Kind.NODE_SET, 0, 0);

    public static Shape graph(long nodeCount, long edgeCount) {
        return new Shape(Value.Kind.GRAPH, nodeCount, edgeCount);
    }

    public static Shape nodeSet() {
        return NODE_SET;
    }

    public boolean isGraph() {
        return kind == Value.Kind.GRAPH;
    }

    @Override
    public String toString() {
        return isGraph() ? "Graph(nodes=" + nodeCount + ", edges=" + edgeCount + ")" : "NodeSet";
    }
}
