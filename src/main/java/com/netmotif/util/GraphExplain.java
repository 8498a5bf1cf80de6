package com.netmotif.util;

import com.netmotif.api.Edge;
import com.netmotif.api.Graph;
import com.netmotif.api.NodeSet;

/**
 * Diagnostic utility for inspecting a built graph.
 *
 * <p>
 * Produces human-readable text for a single node or the whole adjacency, and
 * a Mermaid diagram for embedding in Markdown. Intended for debugging and
 * logging; every call allocates.
 */
public final class GraphExplain {
    private final String name;
    private final Graph graph;

    public GraphExplain(Graph graph) {
        this("G", graph);
    }

    public GraphExplain(String name, Graph graph) {
        this.name = name;
        this.graph = graph;
    }

    /**
     * Dumps degree and neighbours of a single node.
     */
    public String explainNode(int node) {
        if (!graph.hasNode(node))
            throw new IllegalArgumentException("Node " + node + " is not in " + name + " (" + graph.nodeCount()
                    + " nodes)");
        NodeSet neighbors = graph.neighbors(node);
        StringBuilder sb = new StringBuilder(128);
        sb.append("Node: ").append(name).append('.').append(node).append('\n')
                .append("  Degree: ").append(graph.degree(node)).append('\n')
                .append("  Neighbors (").append(neighbors.size()).append("): ");
        appendIds(sb, neighbors);
        return sb.append('\n').toString();
    }

    /**
     * Dumps the adjacency of every node, one line per node.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(64 + graph.nodeCount() * 16);
        sb.append(name).append(" (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.edgeCount()).append(" edges")
                .append(graph.isConnected() ? ", connected" : "").append("):\n");
        for (int i = 0; i < graph.nodeCount(); i++) {
            sb.append("  [").append(i).append("]");
            NodeSet neighbors = graph.neighbors(i);
            if (!neighbors.isEmpty()) {
                sb.append(" -- ");
                appendIds(sb, neighbors);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid diagram. Nodes are declared first, then each edge
     * once as an undirected link.
     */
    public String toMermaid() {
        String prefix = sanitize(name) + "_";
        StringBuilder sb = new StringBuilder(32 + graph.nodeCount() * 16 + graph.edgeCount() * 24);
        sb.append("graph LR;\n");
        for (int i = 0; i < graph.nodeCount(); i++)
            sb.append("  ").append(prefix).append(i).append("((\"").append(i).append("\"));\n");
        for (Edge e : graph.edges())
            sb.append("  ").append(prefix).append(e.a()).append(" --- ").append(prefix).append(e.b()).append(";\n");
        return sb.toString();
    }

    private static void appendIds(StringBuilder sb, NodeSet ids) {
        boolean first = true;
        for (int id : ids) {
            if (!first)
                sb.append(", ");
            sb.append(id);
            first = false;
        }
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
