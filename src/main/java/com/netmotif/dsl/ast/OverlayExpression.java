package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/** {@code Overlay(left, right)}: disjoint union without a bridge. */
public record OverlayExpression(Expression left, Expression right, SourcePosition position) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOverlay(this);
    }
}
