package com.netmotif.motif;

import com.netmotif.api.Graph;

import java.util.List;
import java.util.Optional;

/**
 * The motif families of the language.
 *
 * <p>
 * Each constant carries what both passes need: the checker reads the
 * parameter names, minimums and size functions to validate a call without
 * building anything; the evaluator calls {@link #build(List)}.
 */
public enum MotifKind {
    RING("Ring", new String[] { "n" }, new int[] { 3 },
            a -> a[0], a -> a[0],
            a -> Motifs.ring(a[0])),
    STAR("Star", new String[] { "leaves" }, new int[] { 1 },
            a -> a[0] + 1L, a -> a[0],
            a -> Motifs.star(a[0])),
    GRID("Grid", new String[] { "rows", "cols" }, new int[] { 1, 1 },
            a -> (long) a[0] * a[1], a -> (long) a[0] * (a[1] - 1) + (long) (a[0] - 1) * a[1],
            a -> Motifs.grid(a[0], a[1])),
    TREE("Tree", new String[] { "branching", "height" }, new int[] { 2, 1 },
            a -> Motifs.treeSize(a[0], a[1]), a -> saturatingDecrement(Motifs.treeSize(a[0], a[1])),
            a -> Motifs.tree(a[0], a[1])),
    TWO_RINGS_BRIDGE("TwoRingsBridge", new String[] { "n1", "n2" }, new int[] { 3, 3 },
            a -> (long) a[0] + a[1], a -> (long) a[0] + a[1] + 1,
            a -> Motifs.twoRingsBridge(a[0], a[1])),
    PATH("Path", new String[] { "n" }, new int[] { 2 },
            a -> a[0], a -> a[0] - 1L,
            a -> Motifs.path(a[0])),
    MESH("Mesh", new String[] { "n" }, new int[] { 1 },
            a -> a[0], a -> (long) a[0] * (a[0] - 1) / 2,
            a -> Motifs.mesh(a[0]));

    private final String keyword;
    private final String[] parameters;
    private final int[] minimums;
    private final SizeFunction nodeCount;
    private final SizeFunction edgeCount;
    private final Builder builder;

    MotifKind(String keyword, String[] parameters, int[] minimums,
            SizeFunction nodeCount, SizeFunction edgeCount, Builder builder) {
        this.keyword = keyword;
        this.parameters = parameters;
        this.minimums = minimums;
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
        this.builder = builder;
    }

    /** Surface name, e.g. {@code TwoRingsBridge}. */
    public String keyword() {
        return keyword;
    }

    public int arity() {
        return parameters.length;
    }

    /**
     * Returns a description of the first violated constraint, or empty when
     * {@code args} are in this motif's domain.
     */
    public Optional<String> violation(List<Integer> args) {
        if (args.size() != parameters.length) {
            return Optional.of(keyword + " expects " + parameters.length + " argument"
                    + (parameters.length == 1 ? "" : "s") + " (" + String.join(", ", parameters)
                    + "), got " + args.size());
        }
        for (int i = 0; i < parameters.length; i++) {
            if (args.get(i) < minimums[i]) {
                return Optional.of(keyword + " requires " + parameters[i] + " >= " + minimums[i]
                        + ", got " + args.get(i));
            }
        }
        return Optional.empty();
    }

    /** Node count of the motif for in-domain {@code args}; saturates instead of overflowing. */
    public long nodeCount(List<Integer> args) {
        return nodeCount.apply(toArray(args));
    }

    /** Edge count of the motif for in-domain {@code args}; saturates instead of overflowing. */
    public long edgeCount(List<Integer> args) {
        return edgeCount.apply(toArray(args));
    }

    public Graph build(List<Integer> args) {
        violation(args).ifPresent(v -> {
            throw new IllegalArgumentException(v);
        });
        return builder.build(toArray(args));
    }

    public static Optional<MotifKind> fromKeyword(String text) {
        for (MotifKind k : values()) {
            if (k.keyword.equals(text))
                return Optional.of(k);
        }
        return Optional.empty();
    }

    private static int[] toArray(List<Integer> args) {
        int[] a = new int[args.size()];
        for (int i = 0; i < a.length; i++)
            a[i] = args.get(i);
        return a;
    }

    private static long saturatingDecrement(long v) {
        return v == Long.MAX_VALUE ? v : v - 1;
    }

    @FunctionalInterface
    private interface SizeFunction {
        long apply(int[] args);
    }

    @FunctionalInterface
    private interface Builder {
        Graph build(int[] args);
    }
}
