package com.netmotif.dsl;

/**
 * A 1-based line/column location in program text.
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
