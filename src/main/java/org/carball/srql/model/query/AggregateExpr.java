package org.carball.srql.model.query;

import lombok.Value;

import java.util.Locale;

/**
 * A whitelisted aggregate computation from a {@code stats:} clause. The alias becomes the key
 * of the value in the result row.
 */
@Value
public class AggregateExpr {
    AggregateFunction function;
    String field;
    StatsCondition condition;
    String alias;

    public static AggregateExpr count(String alias) {
        return new AggregateExpr(AggregateFunction.COUNT, null, null, alias);
    }

    public static AggregateExpr of(AggregateFunction function, String field, String alias) {
        return new AggregateExpr(function, field, null, alias);
    }

    public static AggregateExpr conditionalCount(StatsCondition condition, String alias) {
        return new AggregateExpr(AggregateFunction.CONDITIONAL_COUNT, null, condition, alias);
    }

    /**
     * Normalized expression text, without the alias.
     */
    public String getExpression() {
        return switch (function) {
            case COUNT -> "count()";
            case CONDITIONAL_COUNT -> "sum(if(" + condition.toSrql() + ", 1, 0))";
            default -> function.name().toLowerCase(Locale.ROOT) + "(" + field + ")";
        };
    }

    public String toSrql() {
        return getExpression() + " as " + alias;
    }
}
