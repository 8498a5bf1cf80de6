package com.netmotif.motif;

import com.netmotif.api.Edge;
import com.netmotif.api.Graph;
import com.netmotif.api.NodeSet;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Composition and selection operators over {@link Graph} values.
 *
 * <p>
 * Every operator returns a new value; inputs are never modified.
 */
public final class GraphOps {
    private GraphOps() {
        // Utility class
    }

    /**
     * Disjoint union: {@code right}'s nodes are renumbered after {@code left}'s
     * and no edge joins the two halves.
     */
    public static Graph overlay(Graph left, Graph right) {
        int total = Math.addExact(left.nodeCount(), right.nodeCount());
        Graph shiftedRight = right.shifted(left.nodeCount(), total);
        Graph widenedLeft = left.shifted(0, total);
        return widenedLeft.withExtraEdges(shiftedRight.edges());
    }

    /**
     * Disjoint union plus one bridge edge from {@code left}'s node
     * {@code leftNode} to {@code right}'s node {@code rightNode}.
     *
     * @throws IllegalArgumentException if either bridge endpoint is outside its
     *                                  graph.
     */
    public static Graph connect(Graph left, Graph right, int leftNode, int rightNode) {
        if (!left.hasNode(leftNode))
            throw new IllegalArgumentException("Bridge source node " + leftNode + " is not in the first graph");
        if (!right.hasNode(rightNode))
            throw new IllegalArgumentException("Bridge target node " + rightNode + " is not in the second graph");
        return overlay(left, right).withExtraEdges(List.of(Edge.of(leftNode, rightNode + left.nodeCount())));
    }

    public static Graph relabel(Graph graph, Map<Integer, Integer> mapping) {
        return graph.relabel(mapping);
    }

    /** Ids of all nodes whose degree satisfies {@code criteria}; possibly empty. */
    public static NodeSet pick(Graph graph, DegreeCriteria criteria) {
        int[] matches = new int[graph.nodeCount()];
        int n = 0;
        for (int node = 0; node < graph.nodeCount(); node++) {
            if (criteria.test(graph.degree(node)))
                matches[n++] = node;
        }
        return NodeSet.of(Arrays.copyOf(matches, n));
    }
}
