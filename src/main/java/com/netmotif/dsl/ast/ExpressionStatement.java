package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/**
 * A bare expression at top level. Its value becomes the program result.
 */
public record ExpressionStatement(Expression expression, SourcePosition position) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }
}
