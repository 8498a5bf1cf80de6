package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

/**
 * A relabel mapping that is not a permutation of its keys.
 */
public class InvalidMappingException extends DslException {
    public InvalidMappingException(String detail, SourcePosition position) {
        super(ErrorKind.INVALID_MAPPING, detail, position);
    }
}
