package com.netmotif.error;

/**
 * Error categories. {@code LEX} and {@code PARSE} mean the text is malformed;
 * the remaining kinds mean a well-formed program is invalid.
 */
public enum ErrorKind {
    LEX("LexError"),
    PARSE("ParseError"),
    MOTIF_CONSTRAINT("MotifConstraintError"),
    UNKNOWN_NAME("UnknownNameError"),
    NODE_REF_RANGE("NodeRefRangeError"),
    TYPE_MISMATCH("TypeMismatchError"),
    INVALID_MAPPING("InvalidMappingError");

    private final String externalName;

    ErrorKind(String externalName) {
        this.externalName = externalName;
    }

    /** Name used when the error is rendered for callers, e.g. {@code ParseError}. */
    public String externalName() {
        return externalName;
    }
}
