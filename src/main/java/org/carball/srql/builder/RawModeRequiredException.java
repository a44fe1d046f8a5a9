package org.carball.srql.builder;

import org.carball.srql.error.UnsupportedExpressionException;

/**
 * The query uses syntax the structured editor cannot represent; it stays editable as text only.
 */
public class RawModeRequiredException extends UnsupportedExpressionException {

    public RawModeRequiredException(String reason) {
        super(reason);
    }
}
