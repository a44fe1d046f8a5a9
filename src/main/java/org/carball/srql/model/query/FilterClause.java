package org.carball.srql.model.query;

import lombok.Value;

import java.util.List;

@Value
public class FilterClause {
    String field;
    FilterOperator operator;
    List<String> values;

    public FilterClause(String field, FilterOperator operator, List<String> values) {
        if (operator.isList() && values.isEmpty()) {
            throw new IllegalArgumentException(operator + " on '" + field + "' requires at least one value");
        }
        if (operator.isExistence() && !values.isEmpty()) {
            throw new IllegalArgumentException(operator + " on '" + field + "' takes no values");
        }
        if (!operator.isList() && !operator.isExistence() && values.size() != 1) {
            throw new IllegalArgumentException(operator + " on '" + field + "' takes exactly one value");
        }
        this.field = field;
        this.operator = operator;
        this.values = List.copyOf(values);
    }

    public static FilterClause eq(String field, String value) {
        return new FilterClause(field, FilterOperator.EQ, List.of(value));
    }

    public static FilterClause in(String field, List<String> values) {
        return new FilterClause(field, FilterOperator.IN, values);
    }

    public static FilterClause exists(String field) {
        return new FilterClause(field, FilterOperator.EXISTS, List.of());
    }

    public String getValue() {
        return values.isEmpty() ? null : values.get(0);
    }
}
