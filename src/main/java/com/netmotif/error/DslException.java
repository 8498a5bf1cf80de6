package com.netmotif.error;

import com.netmotif.dsl.SourcePosition;

import java.util.Optional;

/**
 * Base class of every user-facing failure of the pipeline.
 *
 * <p>
 * Each subclass fixes one {@link ErrorKind}. The message passed by the
 * failing phase is kept as {@link #detail()}; {@link #getMessage()} appends
 * the source position when one is known.
 */
public abstract class DslException extends RuntimeException {
    private final ErrorKind kind;
    private final String detail;
    private final SourcePosition position;

    protected DslException(ErrorKind kind, String detail, SourcePosition position) {
        super(position == null ? detail : detail + " at " + position);
        this.kind = kind;
        this.detail = detail;
        this.position = position;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** The message without the position suffix. */
    public String detail() {
        return detail;
    }

    public Optional<SourcePosition> position() {
        return Optional.ofNullable(position);
    }
}
