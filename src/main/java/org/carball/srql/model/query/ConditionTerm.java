package org.carball.srql.model.query;

/**
 * One {@code field = 'literal'} comparison inside a conditional count.
 */
public record ConditionTerm(String field, Comparator comparator, String literal) {

    public enum Comparator {
        EQ("="),
        NOT_EQ("<>");

        private final String sql;

        Comparator(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public String toSrql() {
        String op = comparator == Comparator.EQ ? "=" : "!=";
        return field + " " + op + " '" + literal.replace("'", "''") + "'";
    }
}
