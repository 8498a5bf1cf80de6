package com.netmotif.engine;

import com.netmotif.api.Graph;
import com.netmotif.api.NodeSet;
import com.netmotif.api.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Environment produced by running a program.
 *
 * @param bindings bound values, in first-binding order.
 * @param result   value of the last bare expression statement, if any.
 */
public record EvaluationResult(Map<String, Value> bindings, Optional<Value> result) {

    /**
     * Type-safe lookup of a bound graph.
     *
     * @throws IllegalArgumentException if the name is unbound or bound to a node set.
     */
    public Graph graph(String name) {
        if (value(name) instanceof Graph g)
            return g;
        throw new IllegalArgumentException("'" + name + "' is not bound to a Graph");
    }

    public NodeSet nodeSet(String name) {
        if (value(name) instanceof NodeSet s)
            return s;
        throw new IllegalArgumentException("'" + name + "' is not bound to a NodeSet");
    }

    private Value value(String name) {
        Value v = bindings.get(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown binding: " + name);
        return v;
    }
}
