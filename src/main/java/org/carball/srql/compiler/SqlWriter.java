package org.carball.srql.compiler;

import org.carball.srql.config.PlaceholderStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends SQL text and bound parameters in lock step, so placeholder numbers always follow
 * their textual order.
 */
class SqlWriter {

    private final StringBuilder sql = new StringBuilder();
    private final List<Object> params = new ArrayList<>();
    private final PlaceholderStyle style;

    SqlWriter(PlaceholderStyle style) {
        this.style = style;
    }

    SqlWriter sql(String text) {
        sql.append(text);
        return this;
    }

    SqlWriter param(Object value) {
        params.add(value);
        sql.append(style.render(params.size()));
        return this;
    }

    SqlWriter params(List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            param(values.get(i));
        }
        return this;
    }

    String toSql() {
        return sql.toString();
    }

    List<Object> toParams() {
        return List.copyOf(params);
    }
}
