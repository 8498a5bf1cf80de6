package com.netmotif.api;

/**
 * Names node {@code nodeId} of the graph bound to {@code graphName}.
 *
 * <p>
 * Keeping the graph name next to the id stops a bare integer from being
 * reused against a graph of a different size.
 */
public record NodeRef(String graphName, int nodeId) {

    public NodeRef {
        if (graphName == null || graphName.isEmpty())
            throw new IllegalArgumentException("NodeRef graph name must be a non-empty identifier");
        if (nodeId < 0)
            throw new IllegalArgumentException("NodeRef node id must be non-negative, got " + nodeId);
    }

    @Override
    public String toString() {
        return graphName + "." + nodeId;
    }
}
