package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;

/**
 * A top-level program statement. Implementations are {@link LetStatement} and
 * {@link ExpressionStatement}.
 */
public interface Statement {

    SourcePosition position();

    <R> R accept(StatementVisitor<R> visitor);
}
