package com.netmotif.motif;

/**
 * Comparison operators usable in a {@code Pick} degree criterion.
 */
public enum DegreeComparator {
    EQ("="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    DegreeComparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(int degree, int value) {
        return switch (this) {
            case EQ -> degree == value;
            case LT -> degree < value;
            case GT -> degree > value;
            case LE -> degree <= value;
            case GE -> degree >= value;
        };
    }

    public static DegreeComparator fromSymbol(String symbol) {
        for (DegreeComparator c : values()) {
            if (c.symbol.equals(symbol))
                return c;
        }
        throw new IllegalArgumentException("Unknown degree comparator: " + symbol);
    }
}
