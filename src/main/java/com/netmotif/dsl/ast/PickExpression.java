package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/** {@code Pick(target, deg <op> value)} */
public record PickExpression(Expression target, DegreeCriteriaLiteral criteria, SourcePosition position)
        implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPick(this);
    }
}
