package org.carball.srql.error;

/**
 * Cursor that does not decode, fails its signature check, or was issued for another query shape.
 */
public class InvalidCursorException extends SrqlException {

    public InvalidCursorException(String message) {
        super(ErrorKind.INVALID_CURSOR, message);
    }

    public InvalidCursorException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CURSOR, message, -1, cause);
    }
}
