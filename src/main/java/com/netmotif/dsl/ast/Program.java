package com.netmotif.dsl.ast;

import java.util.List;

/**
 * A parsed program: statements in source order.
 */
public record Program(List<Statement> statements) {

    public Program {
        statements = List.copyOf(statements);
    }
}
