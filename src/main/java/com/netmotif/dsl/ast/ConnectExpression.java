package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/** {@code Connect(left, right, bridge=(A.i, B.j))} */
public record ConnectExpression(Expression left, Expression right,
        NodeRefLiteral leftBridge, NodeRefLiteral rightBridge,
        SourcePosition position) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConnect(this);
    }
}
