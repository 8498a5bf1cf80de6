package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * A node id outside the graph it addresses.
 */
public class NodeRefRangeException extends DslException {
    public NodeRefRangeException(String detail, SourcePosition position) {
        super(ErrorKind.NODE_REF_RANGE, detail, position);
    }
}
