package org.carball.srql.error;

/**
 * Opaque failure reported by the executor (timeout, connection loss, ...).
 */
public class QueryExecutionException extends SrqlException {

    public QueryExecutionException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION, message, -1, cause);
    }

    public QueryExecutionException(String message) {
        super(ErrorKind.EXECUTION, message);
    }
}
