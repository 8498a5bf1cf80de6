package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

public record NameExpression(String name, SourcePosition position) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitName(this);
    }
}
