package com.netmotif.dsl.ast;

public interface StatementVisitor<R> {

    R visitLet(LetStatement statement);

    R visitExpression(ExpressionStatement statement);
}
