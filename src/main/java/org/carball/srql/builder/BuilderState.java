package org.carball.srql.builder;

import lombok.Builder;
import lombok.Value;
import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.RelativeWindow;
import org.carball.srql.model.query.SortSpec;

import java.util.List;

/**
 * Structured mirror of a query for the interactive editor. Instances produced by
 * {@link QueryBuilder} are always canonical: repeated equality filters are merged and set
 * values are sorted.
 */
@Value
@Builder(toBuilder = true)
public class BuilderState {
    String entity;

    @Builder.Default
    List<FilterClause> filters = List.of();

    RelativeWindow time;
    SortSpec sort;
    int limit;
}
