package com.netmotif.api;

/**
 * An undirected edge in canonical orientation ({@code a < b}).
 *
 * <p>
 * Use {@link #of(int, int)} to build one from endpoints given in any order;
 * {@code Edge.of(3, 1)} and {@code Edge.of(1, 3)} are equal.
 */
public record Edge(int a, int b) implements Comparable<Edge> {

    public Edge {
        if (a == b)
            throw new GraphConstructionException("Self-loop not allowed: (" + a + ", " + b + ")");
        if (a < 0 || b < 0)
            throw new GraphConstructionException("Negative node id in edge (" + a + ", " + b + ")");
        if (a > b)
            throw new GraphConstructionException("Edge not canonical: (" + a + ", " + b + "), use Edge.of");
    }

    /** Creates the canonical edge between {@code u} and {@code v}. */
    public static Edge of(int u, int v) {
        return u <= v ? new Edge(u, v) : new Edge(v, u);
    }

    public boolean touches(int node) {
        return a == node || b == node;
    }

    /** Returns the endpoint opposite to {@code node}. */
    public int other(int node) {
        return node == a ? b : a;
    }

    @Override
    public int compareTo(Edge o) {
        int c = Integer.compare(a, o.a);
        return c != 0 ? c : Integer.compare(b, o.b);
    }

    @Override
    public String toString() {
        return "(" + a + ", " + b + ")";
    }
}
