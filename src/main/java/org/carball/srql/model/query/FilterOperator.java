package org.carball.srql.model.query;

/**
 * Predicate operators a field filter can compile to.
 */
public enum FilterOperator {
    EQ,
    NOT_EQ,
    IN,
    NOT_IN,
    /** {@code v%}: starts-with. */
    WILDCARD_SUFFIX,
    NOT_WILDCARD_SUFFIX,
    /** {@code %v}: ends-with. */
    WILDCARD_PREFIX,
    NOT_WILDCARD_PREFIX,
    /** {@code %v%}: contains. */
    WILDCARD_PREFIX_SUFFIX,
    NOT_WILDCARD_PREFIX_SUFFIX,
    EXISTS,
    NOT_EXISTS;

    public FilterOperator negate() {
        return switch (this) {
            case EQ -> NOT_EQ;
            case NOT_EQ -> EQ;
            case IN -> NOT_IN;
            case NOT_IN -> IN;
            case WILDCARD_SUFFIX -> NOT_WILDCARD_SUFFIX;
            case NOT_WILDCARD_SUFFIX -> WILDCARD_SUFFIX;
            case WILDCARD_PREFIX -> NOT_WILDCARD_PREFIX;
            case NOT_WILDCARD_PREFIX -> WILDCARD_PREFIX;
            case WILDCARD_PREFIX_SUFFIX -> NOT_WILDCARD_PREFIX_SUFFIX;
            case NOT_WILDCARD_PREFIX_SUFFIX -> WILDCARD_PREFIX_SUFFIX;
            case EXISTS -> NOT_EXISTS;
            case NOT_EXISTS -> EXISTS;
        };
    }

    public boolean isNegative() {
        return switch (this) {
            case NOT_EQ, NOT_IN, NOT_WILDCARD_SUFFIX, NOT_WILDCARD_PREFIX,
                 NOT_WILDCARD_PREFIX_SUFFIX, NOT_EXISTS -> true;
            default -> false;
        };
    }

    public boolean isWildcard() {
        return switch (this) {
            case WILDCARD_SUFFIX, NOT_WILDCARD_SUFFIX, WILDCARD_PREFIX, NOT_WILDCARD_PREFIX,
                 WILDCARD_PREFIX_SUFFIX, NOT_WILDCARD_PREFIX_SUFFIX -> true;
            default -> false;
        };
    }

    /**
     * Equality and set membership, the operators repeated filters accumulate into.
     */
    public boolean isMembership() {
        return this == EQ || this == IN || this == NOT_EQ || this == NOT_IN;
    }

    public boolean isExistence() {
        return this == EXISTS || this == NOT_EXISTS;
    }

    public boolean isList() {
        return this == IN || this == NOT_IN;
    }
}
