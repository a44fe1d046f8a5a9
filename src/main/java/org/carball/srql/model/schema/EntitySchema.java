package org.carball.srql.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.srql.model.query.SortDirection;
import org.carball.srql.model.query.SortSpec;

import java.util.List;

/**
 * Allow-listed physical view of one queryable entity.
 */
@Value
@Builder(toBuilder = true)
public class EntitySchema {
    String name;
    String table;

    @Singular
    List<String> fields;

    @Singular
    List<String> aliases;

    String timestampColumn;
    String tieBreakColumn;
    String defaultSortField;

    @Builder.Default
    SortDirection defaultSortDirection = SortDirection.DESC;

    /** Metric value aggregated by {@code agg:}; null for non-metric entities. */
    String valueColumn;

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    public SortSpec getDefaultSort() {
        return new SortSpec(defaultSortField, defaultSortDirection);
    }

    public boolean isMetric() {
        return valueColumn != null;
    }

    /**
     * Throws if the schema references columns outside its own field list.
     */
    public void validate() {
        if (name == null || name.isBlank() || table == null || table.isBlank()) {
            throw new IllegalArgumentException("Entity requires a name and a table");
        }
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Entity '" + name + "' declares no fields");
        }
        requireField(tieBreakColumn, "tie-break column");
        requireField(defaultSortField, "default sort field");
        if (timestampColumn != null) {
            requireField(timestampColumn, "timestamp column");
        }
        if (valueColumn != null) {
            requireField(valueColumn, "value column");
        }
    }

    private void requireField(String column, String role) {
        if (column == null || !fields.contains(column)) {
            throw new IllegalArgumentException(
                    "Entity '" + name + "' " + role + " '" + column + "' is not one of its fields");
        }
    }
}
