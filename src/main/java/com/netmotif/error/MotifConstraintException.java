package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * Wrong arity or out-of-domain parameter in a motif call or selector.
 */
public class MotifConstraintException extends DslException {
    public MotifConstraintException(String detail, SourcePosition position) {
        super(ErrorKind.MOTIF_CONSTRAINT, detail, position);
    }
}
