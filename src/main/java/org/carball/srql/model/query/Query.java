package org.carball.srql.model.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed, syntax-checked SRQL query. Entity and field names are lowercased but not yet
 * checked against a schema; that happens during compilation.
 */
@Value
@Builder(toBuilder = true)
public class Query {
    String entity;

    @Builder.Default
    List<FilterClause> filters = List.of();

    RelativeWindow timeRange;
    SortSpec sort;
    Integer limit;
    String cursor;

    @Builder.Default
    PageDirection direction = PageDirection.NEXT;

    @Builder.Default
    List<AggregateExpr> stats = List.of();

    BucketInterval bucket;
    String seriesBy;
    ValueAggregation agg;
    boolean stream;

    public boolean hasStats() {
        return !stats.isEmpty();
    }

    /**
     * Aggregated queries return summary rows and are not paginated.
     */
    public boolean isAggregate() {
        return hasStats() || agg != null;
    }
}
