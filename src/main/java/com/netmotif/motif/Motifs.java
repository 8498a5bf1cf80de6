package com.netmotif.motif;

import com.netmotif.api.Graph;

/**
 * Builders for the fixed topology families.
 *
 * <p>
 * Each builder is a pure function of its integer parameters. Parameters
 * outside a family's domain are rejected with
 * {@link IllegalArgumentException}; the checker rejects such programs before
 * any builder runs.
 */
public final class Motifs {
    private Motifs() {
        // Utility class
    }

    /** A single cycle {@code 0 - 1 - ... - (n-1) - 0}. */
    public static Graph ring(int n) {
        require(n >= 3, "Ring motif requires n >= 3, got " + n);
        Graph.Builder b = Graph.builder(n);
        for (int i = 0; i < n; i++)
            b.addEdge(i, (i + 1) % n);
        return b.build();
    }

    /** Hub 0 with {@code leaves} spokes; {@code leaves + 1} nodes in total. */
    public static Graph star(int leaves) {
        require(leaves >= 1, "Star motif requires at least 1 leaf, got " + leaves);
        Graph.Builder b = Graph.builder(leaves + 1);
        for (int i = 1; i <= leaves; i++)
            b.addEdge(0, i);
        return b.build();
    }

    /** Row-major {@code rows x cols} lattice; node {@code r*cols + c}. */
    public static Graph grid(int rows, int cols) {
        require(rows >= 1, "Grid motif requires rows >= 1, got " + rows);
        require(cols >= 1, "Grid motif requires cols >= 1, got " + cols);
        Graph.Builder b = Graph.builder(Math.multiplyExact(rows, cols));
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int id = r * cols + c;
                if (c + 1 < cols)
                    b.addEdge(id, id + 1);
                if (r + 1 < rows)
                    b.addEdge(id, id + cols);
            }
        }
        return b.build();
    }

    /**
     * Balanced tree rooted at 0 with {@code height} levels below the root.
     * Children of node p are {@code branching*p + 1 .. branching*p + branching}.
     */
    public static Graph tree(int branching, int height) {
        require(branching >= 2, "Tree motif requires branching factor >= 2, got " + branching);
        require(height >= 1, "Tree motif requires height >= 1, got " + height);
        long size = treeSize(branching, height);
        require(size <= Integer.MAX_VALUE, "Tree(" + branching + ", " + height + ") is too large");
        int n = (int) size;
        Graph.Builder b = Graph.builder(n);
        for (int child = 1; child < n; child++)
            b.addEdge((child - 1) / branching, child);
        return b.build();
    }

    /** {@code ring(n1)} and {@code ring(n2)} joined by the edge between their nodes 0. */
    public static Graph twoRingsBridge(int n1, int n2) {
        require(n1 >= 3, "TwoRingsBridge motif requires first ring size >= 3, got " + n1);
        require(n2 >= 3, "TwoRingsBridge motif requires second ring size >= 3, got " + n2);
        return GraphOps.connect(ring(n1), ring(n2), 0, 0);
    }

    /** A simple path {@code 0 - 1 - ... - (n-1)}. */
    public static Graph path(int n) {
        require(n >= 2, "Path motif requires n >= 2, got " + n);
        Graph.Builder b = Graph.builder(n);
        for (int i = 0; i + 1 < n; i++)
            b.addEdge(i, i + 1);
        return b.build();
    }

    /** The complete graph on {@code n} nodes. */
    public static Graph mesh(int n) {
        require(n >= 1, "Mesh motif requires n >= 1, got " + n);
        Graph.Builder b = Graph.builder(n);
        for (int i = 0; i < n; i++)
            for (int j = i + 1; j < n; j++)
                b.addEdge(i, j);
        return b.build();
    }

    /**
     * Node count of {@code tree(branching, height)}, saturating at
     * {@link Long#MAX_VALUE}.
     */
    static long treeSize(long branching, long height) {
        long total = 1, level = 1;
        for (long h = 0; h < height; h++) {
            if (level > Long.MAX_VALUE / branching)
                return Long.MAX_VALUE;
            level *= branching;
            if (total > Long.MAX_VALUE - level)
                return Long.MAX_VALUE;
            total += level;
        }
        return total;
    }

    private static void require(boolean condition, String message) {
        if (!condition)
            throw new IllegalArgumentException(message);
    }
}
