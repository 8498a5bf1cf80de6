package com.netmotif.api;

import java.util.*;

/**
 * Immutable undirected graph over the node ids {@code 0 .. nodeCount-1}.
 *
 * <p>
 * Every instance is valid by construction: all edges are in range, none is a
 * self-loop, and each is stored once in canonical orientation. Invalid input
 * fails with {@link GraphConstructionException} before any instance exists.
 * Operations that "change" a graph return a new one; the receiver is never
 * touched, so graphs can be shared freely between the checker, evaluator and
 * callers.
 *
 * <p>
 * Adjacency is kept in CSR form:
 * <ul>
 * <li>{@code adjOffset[i] .. adjOffset[i+1]} delimits node i's neighbours in
 * {@code adjList}.</li>
 * <li>Neighbours of each node are sorted ascending.</li>
 * </ul>
 * Degree lookups are O(1) and neighbour iteration reads contiguous ints.
 */
public final class Graph implements Value {
    private static final Graph EMPTY = new Graph(0, new Edge[0]);

    private final int nodeCount;

    // Sorted, duplicate-free.
    private final Edge[] edges;

    private final int[] adjOffset;
    private final int[] adjList;

    private Graph(int nodeCount, Edge[] sortedEdges) {
        this.nodeCount = nodeCount;
        this.edges = sortedEdges;

        int[] deg = new int[nodeCount];
        for (Edge e : sortedEdges) {
            deg[e.a()]++;
            deg[e.b()]++;
        }
        this.adjOffset = new int[nodeCount + 1];
        for (int i = 0; i < nodeCount; i++)
            adjOffset[i + 1] = adjOffset[i] + deg[i];

        this.adjList = new int[adjOffset[nodeCount]];
        int[] fill = Arrays.copyOf(adjOffset, nodeCount);
        for (Edge e : sortedEdges) {
            adjList[fill[e.a()]++] = e.b();
            adjList[fill[e.b()]++] = e.a();
        }
        for (int i = 0; i < nodeCount; i++)
            Arrays.sort(adjList, adjOffset[i], adjOffset[i + 1]);
    }

    /** A graph with no nodes. */
    public static Graph empty() {
        return EMPTY;
    }

    /**
     * Validates and builds a graph.
     *
     * @param nodeCount number of nodes, must be non-negative.
     * @param edges     edges in any orientation; duplicates collapse.
     * @throws GraphConstructionException on a negative count or an edge
     *                                    touching a node outside the range.
     */
    public static Graph of(int nodeCount, Collection<Edge> edges) {
        if (nodeCount < 0)
            throw new GraphConstructionException("Node count must be non-negative, got " + nodeCount);
        TreeSet<Edge> sorted = new TreeSet<>();
        for (Edge e : edges) {
            if (e.b() >= nodeCount)
                throw new GraphConstructionException(
                        "Edge " + e + " references node outside the range 0.." + (nodeCount - 1));
            sorted.add(e);
        }
        return new Graph(nodeCount, sorted.toArray(new Edge[0]));
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    @Override
    public Kind kind() {
        return Kind.GRAPH;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int edgeCount() {
        return edges.length;
    }

    /** Edges in ascending canonical order. */
    public List<Edge> edges() {
        return List.of(edges);
    }

    public boolean hasNode(int node) {
        return node >= 0 && node < nodeCount;
    }

    public boolean hasEdge(int u, int v) {
        if (u == v || !hasNode(u) || !hasNode(v))
            return false;
        return Arrays.binarySearch(adjList, adjOffset[u], adjOffset[u + 1], v) >= 0;
    }

    public int degree(int node) {
        requireNode(node);
        return adjOffset[node + 1] - adjOffset[node];
    }

    public NodeSet neighbors(int node) {
        requireNode(node);
        return NodeSet.of(Arrays.copyOfRange(adjList, adjOffset[node], adjOffset[node + 1]));
    }

    /** True for the empty graph and for graphs where every node reaches node 0. */
    public boolean isConnected() {
        if (nodeCount == 0)
            return true;
        boolean[] seen = new boolean[nodeCount];
        int[] queue = new int[nodeCount];
        int head = 0, tail = 0;
        queue[tail++] = 0;
        seen[0] = true;
        while (head < tail) {
            int curr = queue[head++];
            for (int i = adjOffset[curr]; i < adjOffset[curr + 1]; i++) {
                int next = adjList[i];
                if (!seen[next]) {
                    seen[next] = true;
                    queue[tail++] = next;
                }
            }
        }
        return tail == nodeCount;
    }

    /** Returns a new graph with the same nodes and the union of the edge sets. */
    public Graph withExtraEdges(Collection<Edge> extra) {
        if (extra.isEmpty())
            return this;
        List<Edge> all = new ArrayList<>(edges.length + extra.size());
        all.addAll(Arrays.asList(edges));
        all.addAll(extra);
        return of(nodeCount, all);
    }

    /**
     * Embeds this graph into a node space of {@code targetNodeCount} nodes,
     * moving every id up by {@code offset}.
     */
    public Graph shifted(int offset, int targetNodeCount) {
        if (offset < 0)
            throw new GraphConstructionException("Offset must be non-negative, got " + offset);
        if ((long) offset + nodeCount > targetNodeCount)
            throw new GraphConstructionException("Shifted graph needs " + ((long) offset + nodeCount)
                    + " nodes but target has " + targetNodeCount);
        List<Edge> moved = new ArrayList<>(edges.length);
        for (Edge e : edges)
            moved.add(new Edge(e.a() + offset, e.b() + offset));
        return of(targetNodeCount, moved);
    }

    /**
     * Renames nodes according to {@code mapping}; ids absent from the mapping keep
     * their id.
     *
     * @throws GraphConstructionException if a key or value is out of range, or the
     *                                    values are not a permutation of the keys.
     */
    public Graph relabel(Map<Integer, Integer> mapping) {
        if (mapping.isEmpty())
            return this;
        for (var entry : mapping.entrySet()) {
            if (!hasNode(entry.getKey()) || !hasNode(entry.getValue()))
                throw new GraphConstructionException("Relabel entry " + entry.getKey() + " -> "
                        + entry.getValue() + " outside the range 0.." + (nodeCount - 1));
        }
        if (!new HashSet<>(mapping.values()).equals(mapping.keySet()))
            throw new GraphConstructionException("Relabel mapping must permute its own keys: " + mapping);

        List<Edge> renamed = new ArrayList<>(edges.length);
        for (Edge e : edges)
            renamed.add(Edge.of(mapping.getOrDefault(e.a(), e.a()), mapping.getOrDefault(e.b(), e.b())));
        return of(nodeCount, renamed);
    }

    private void requireNode(int node) {
        if (!hasNode(node))
            throw new IllegalArgumentException("Node " + node + " is not in this graph (0.." + (nodeCount - 1) + ")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Graph other))
            return false;
        return nodeCount == other.nodeCount && Arrays.equals(edges, other.edges);
    }

    @Override
    public int hashCode() {
        return 31 * nodeCount + Arrays.hashCode(edges);
    }

    @Override
    public String toString() {
        return "Graph(nodes=" + nodeCount + ", edges=" + edges.length + ")";
    }

    /**
     * Accumulates edges for a graph of fixed size. Endpoints are range-checked as
     * they are added.
     */
    public static final class Builder {
        private final int nodeCount;
        private final List<Edge> edges = new ArrayList<>();

        private Builder(int nodeCount) {
            if (nodeCount < 0)
                throw new GraphConstructionException("Node count must be non-negative, got " + nodeCount);
            this.nodeCount = nodeCount;
        }

        public Builder addEdge(int u, int v) {
            if (u < 0 || u >= nodeCount || v < 0 || v >= nodeCount)
                throw new GraphConstructionException(
                        "Edge (" + u + ", " + v + ") references node outside the range 0.." + (nodeCount - 1));
            edges.add(Edge.of(u, v));
            return this;
        }

        public Graph build() {
            return Graph.of(nodeCount, edges);
        }
    }
}
