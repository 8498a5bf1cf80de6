package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code Relabel(target, {from: to, ...})}; entries keep source order. */
public record RelabelExpression(Expression target, Map<Integer, Integer> mapping, SourcePosition position)
        implements Expression {

    public RelabelExpression {
        mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRelabel(this);
    }
}
