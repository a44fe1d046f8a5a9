package org.carball.srql.error;

/**
 * Only raised when strict limits are configured; the default policy clamps.
 */
public class LimitOutOfRangeException extends SrqlException {

    public LimitOutOfRangeException(long limit, int max) {
        super(ErrorKind.LIMIT_OUT_OF_RANGE, "limit " + limit + " must be between 1 and " + max);
    }
}
