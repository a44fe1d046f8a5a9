package org.carball.srql.error;

/**
 * Malformed token, quoting or clause value.
 */
public class SrqlSyntaxException extends SrqlException {

    public SrqlSyntaxException(String message, int offset) {
        super(ErrorKind.SYNTAX, message, offset);
    }

    public SrqlSyntaxException(String message) {
        super(ErrorKind.SYNTAX, message);
    }
}
