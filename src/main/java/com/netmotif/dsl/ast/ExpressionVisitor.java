package com.netmotif.dsl.ast;

public interface ExpressionVisitor<R> {

    R visitMotif(MotifExpression expr);

    R visitName(NameExpression expr);

    R visitConnect(ConnectExpression expr);

    R visitOverlay(OverlayExpression expr);

    R visitRelabel(RelabelExpression expr);

    R visitPick(PickExpression expr);
}
