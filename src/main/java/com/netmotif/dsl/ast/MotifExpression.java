package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;
import com.netmotif.motif.MotifKind;

import java.util.List;

/** {@code Kind(arg, ...)}; arity is not validated until checking. */
public record MotifExpression(MotifKind kind, List<Integer> args, SourcePosition position) implements Expression {

    public MotifExpression {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMotif(this);
    }
}
