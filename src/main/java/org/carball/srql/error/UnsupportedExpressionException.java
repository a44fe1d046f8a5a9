package org.carball.srql.error;

/**
 * Expression outside the whitelisted stats/aggregation grammar.
 */
public class UnsupportedExpressionException extends SrqlException {

    public UnsupportedExpressionException(String message) {
        super(ErrorKind.UNSUPPORTED_EXPRESSION, message);
    }
}
