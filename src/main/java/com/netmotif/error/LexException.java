package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * A character or literal that matches no token rule.
 */
public class LexException extends DslException {
    public LexException(String detail, SourcePosition position) {
        super(ErrorKind.LEX, detail, position);
    }
}
