package org.carball.srql.error;

import lombok.Getter;

/**
 * Base of the checked exceptions thrown inside the parse/compile/execute pipeline.
 */
@Getter
public class SrqlException extends Exception {

    private final ErrorKind kind;
    private final int offset;

    public SrqlException(ErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public SrqlException(ErrorKind kind, String message, int offset) {
        this(kind, message, offset, null);
    }

    public SrqlException(ErrorKind kind, String message, int offset, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.offset = offset;
    }
}
