package org.carball.srql.error;

/**
 * A single-valued clause appeared more than once.
 */
public class DuplicateClauseException extends SrqlException {

    private final String clause;

    public DuplicateClauseException(String clause, int offset) {
        super(ErrorKind.DUPLICATE_CLAUSE, "clause '" + clause + "' may only appear once", offset);
        this.clause = clause;
    }

    public DuplicateClauseException(String clause, String message) {
        super(ErrorKind.DUPLICATE_CLAUSE, message);
        this.clause = clause;
    }

    public String getClause() {
        return clause;
    }
}
