package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/**
 * An expression node. The set of implementations is closed: every kind has a
 * method on {@link ExpressionVisitor}, so adding one forces both the checker
 * and the evaluator to handle it.
 */
public interface Expression {

    SourcePosition position();

    <R> R accept(ExpressionVisitor<R> visitor);
}
