package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * A value of the wrong kind in a position, e.g. a node set where a graph is required.
 */
public class TypeMismatchException extends DslException {
    public TypeMismatchException(String detail, SourcePosition position) {
        super(ErrorKind.TYPE_MISMATCH, detail, position);
    }
}
