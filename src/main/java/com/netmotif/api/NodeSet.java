package com.netmotif.api;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Immutable set of node ids, typically the result of a selection over one
 * graph.
 *
 * <p>
 * A node set does not know which graph its ids came from; callers that need
 * to address nodes again must pair the ids with a graph name themselves.
 * Iteration is in ascending id order.
 */
public final class NodeSet implements Value, Iterable<Integer> {
    private static final NodeSet EMPTY = new NodeSet(new int[0]);

    // Sorted ascending, distinct.
    private final int[] ids;

    private NodeSet(int[] sortedDistinct) {
        this.ids = sortedDistinct;
    }

    public static NodeSet empty() {
        return EMPTY;
    }

    /** Builds a set from ids in any order; duplicates collapse. */
    public static NodeSet of(int... ids) {
        if (ids.length == 0)
            return EMPTY;
        int[] sorted = ids.clone();
        Arrays.sort(sorted);
        if (sorted[0] < 0)
            throw new IllegalArgumentException("Node ids must be non-negative, got " + sorted[0]);
        int n = 1;
        for (int i = 1; i < sorted.length; i++)
            if (sorted[i] != sorted[n - 1])
                sorted[n++] = sorted[i];
        return new NodeSet(n == sorted.length ? sorted : Arrays.copyOf(sorted, n));
    }

    @Override
    public Kind kind() {
        return Kind.NODE_SET;
    }

    public boolean contains(int id) {
        return Arrays.binarySearch(ids, id) >= 0;
    }

    public int size() {
        return ids.length;
    }

    public boolean isEmpty() {
        return ids.length == 0;
    }

    /** Ids in ascending order, as a fresh array. */
    public int[] toArray() {
        return ids.clone();
    }

    public NodeSet union(NodeSet other) {
        int[] merged = Arrays.copyOf(ids, ids.length + other.ids.length);
        System.arraycopy(other.ids, 0, merged, ids.length, other.ids.length);
        return of(merged);
    }

    public NodeSet intersection(NodeSet other) {
        int[] out = new int[Math.min(ids.length, other.ids.length)];
        int i = 0, j = 0, n = 0;
        while (i < ids.length && j < other.ids.length) {
            if (ids[i] < other.ids[j])
                i++;
            else if (ids[i] > other.ids[j])
                j++;
            else {
                out[n++] = ids[i];
                i++;
                j++;
            }
        }
        return n == 0 ? EMPTY : new NodeSet(Arrays.copyOf(out, n));
    }

    @Override
    public Iterator<Integer> iterator() {
        return new PrimitiveIterator.OfInt() {
            private int pos;

            @Override
            public boolean hasNext() {
                return pos < ids.length;
            }

            @Override
            public int nextInt() {
                if (pos >= ids.length)
                    throw new NoSuchElementException();
                return ids[pos++];
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof NodeSet other && Arrays.equals(ids, other.ids));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ids);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NodeSet({");
        for (int i = 0; i < ids.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(ids[i]);
        }
        return sb.append("})").toString();
    }
}
