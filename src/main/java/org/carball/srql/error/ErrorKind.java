package org.carball.srql.error;

import lombok.Getter;

/**
 * Distinct, user-displayable failure reasons reported by the query pipeline.
 */
@Getter
public enum ErrorKind {
    SYNTAX("Syntax error"),
    DUPLICATE_CLAUSE("Duplicate clause"),
    UNKNOWN_ENTITY("Unknown entity"),
    UNKNOWN_FIELD("Unknown field"),
    UNSUPPORTED_EXPRESSION("Unsupported expression"),
    INVALID_CURSOR("Invalid cursor"),
    LIMIT_OUT_OF_RANGE("Limit out of range"),
    EXECUTION("Query execution failed");

    private final String title;

    ErrorKind(String title) {
        this.title = title;
    }
}
