package com.netmotif.dsl.ast;

import com.netmotif.api.NodeRef;
import com.netmotif.dsl.SourcePosition;

/** {@code NAME.INT} as written in a bridge. */
public record NodeRefLiteral(NodeRef ref, SourcePosition position) {

    public String graphName() {
        return ref.graphName();
    }

    public int nodeId() {
        return ref.nodeId();
    }
}
