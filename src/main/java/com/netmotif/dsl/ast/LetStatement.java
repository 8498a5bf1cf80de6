package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/** {@code let NAME = expression} */
public record LetStatement(String name, Expression expression, SourcePosition position) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}
