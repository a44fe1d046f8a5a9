package org.carball.srql.parser;

import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds repeated filters on the same field: equality/membership clauses accumulate into one
 * set clause (positive and negative sides separately) and exact duplicates collapse. The
 * merged clause keeps the position of the first occurrence.
 */
public final class FilterAccumulator {

    private final List<FilterClause> clauses = new ArrayList<>();
    private final boolean sortSetValues;

    public FilterAccumulator() {
        this(false);
    }

    /**
     * @param sortSetValues sort values inside {@code IN}/{@code NOT IN} sets, as the builder's
     *                      canonical form requires
     */
    public FilterAccumulator(boolean sortSetValues) {
        this.sortSetValues = sortSetValues;
    }

    public static List<FilterClause> accumulate(List<FilterClause> filters, boolean sortSetValues) {
        FilterAccumulator accumulator = new FilterAccumulator(sortSetValues);
        filters.forEach(accumulator::add);
        return accumulator.result();
    }

    public FilterAccumulator add(FilterClause filter) {
        FilterClause incoming = normalize(filter);

        if (incoming.getOperator().isMembership()) {
            for (int i = 0; i < clauses.size(); i++) {
                FilterClause existing = clauses.get(i);
                if (existing.getField().equals(incoming.getField())
                        && existing.getOperator().isMembership()
                        && existing.getOperator().isNegative() == incoming.getOperator().isNegative()) {
                    clauses.set(i, merge(existing, incoming));
                    return this;
                }
            }
        } else if (clauses.contains(incoming)) {
            return this;
        }

        clauses.add(incoming);
        return this;
    }

    public List<FilterClause> result() {
        return List.copyOf(clauses);
    }

    private FilterClause merge(FilterClause existing, FilterClause incoming) {
        Set<String> values = new LinkedHashSet<>(existing.getValues());
        values.addAll(incoming.getValues());

        boolean negative = existing.getOperator().isNegative();
        boolean bothScalar = !existing.getOperator().isList() && !incoming.getOperator().isList();
        FilterOperator operator;
        if (bothScalar && values.size() == 1) {
            operator = negative ? FilterOperator.NOT_EQ : FilterOperator.EQ;
        } else {
            operator = negative ? FilterOperator.NOT_IN : FilterOperator.IN;
        }
        return normalize(new FilterClause(existing.getField(), operator, new ArrayList<>(values)));
    }

    private FilterClause normalize(FilterClause filter) {
        if (!sortSetValues || !filter.getOperator().isList()) {
            return filter;
        }
        List<String> values = new ArrayList<>(new LinkedHashSet<>(filter.getValues()));
        values.sort(null);
        return new FilterClause(filter.getField(), filter.getOperator(), values);
    }
}
