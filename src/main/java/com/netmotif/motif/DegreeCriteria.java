package com.netmotif.motif;

/**
 * Predicate over a node's degree, e.g. {@code deg >= 3}.
 */
public record DegreeCriteria(DegreeComparator comparator, int value) {

    public DegreeCriteria {
        if (comparator == null)
            throw new IllegalArgumentException("Degree comparator is required");
        if (value < 0)
            throw new IllegalArgumentException("Degree criteria value must be non-negative, got " + value);
    }

    public static DegreeCriteria exactly(int degree) {
        return new DegreeCriteria(DegreeComparator.EQ, degree);
    }

    public boolean test(int degree) {
        return comparator.test(degree, value);
    }

    @Override
    public String toString() {
        return "deg " + comparator.symbol() + " " + value;
    }
}
