package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * Token stream does not follow the grammar.
 */
public class ParseException extends DslException {
    public ParseException(String detail, SourcePosition position) {
        super(ErrorKind.PARSE, detail, position);
    }
}
