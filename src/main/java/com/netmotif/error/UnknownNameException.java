package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * Use of a name before it is bound.
 */
public class UnknownNameException extends DslException {
    public UnknownNameException(String detail, SourcePosition position) {
        super(ErrorKind.UNKNOWN_NAME, detail, position);
    }
}
