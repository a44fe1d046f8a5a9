package org.carball.srql.model.query;

public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,
    /** {@code sum(if(<condition>, 1, 0))} */
    CONDITIONAL_COUNT
}
