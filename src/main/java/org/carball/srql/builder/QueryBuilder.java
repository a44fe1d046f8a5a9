package org.carball.srql.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.config.SrqlConfig;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.UnknownFieldException;
import org.carball.srql.error.UnsupportedExpressionException;
import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.query.RelativeWindow;
import org.carball.srql.model.query.SortSpec;
import org.carball.srql.model.schema.EntitySchema;
import org.carball.srql.model.schema.SchemaCatalog;
import org.carball.srql.parser.FilterAccumulator;
import org.carball.srql.parser.QueryParser;
import org.carball.srql.parser.QuerySerializer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Operations on {@link BuilderState}. Every operation returns a new canonical state, so
 * {@code parse(serialize(state))} gives back an equal state.
 */
@Slf4j
public class QueryBuilder {

    private static final Set<FilterOperator> REPRESENTABLE = EnumSet.of(
            FilterOperator.EQ, FilterOperator.NOT_EQ,
            FilterOperator.IN, FilterOperator.NOT_IN,
            FilterOperator.EXISTS, FilterOperator.NOT_EXISTS);

    private final SchemaCatalog catalog;
    private final SrqlConfig config;
    private final QueryParser parser;

    public QueryBuilder(SchemaCatalog catalog, SrqlConfig config) {
        this.catalog = catalog;
        this.config = config;
        this.parser = new QueryParser(config.getMaxStatsExpressions());
    }

    public BuilderState initialState(String entity) throws SrqlException {
        EntitySchema schema = catalog.resolve(entity);
        return BuilderState.builder()
                .entity(schema.getName())
                .sort(schema.getDefaultSort())
                .limit(config.clampLimit(null))
                .build();
    }

    /**
     * Canonical text: {@code in:<e> [time:<w>] <filters...> sort:<f>:<dir> limit:<n>}.
     */
    public String serialize(BuilderState state) {
        return QuerySerializer.serialize(Query.builder()
                .entity(state.getEntity())
                .timeRange(state.getTime())
                .filters(state.getFilters())
                .sort(state.getSort())
                .limit(state.getLimit())
                .build());
    }

    /**
     * Reads query text into a state.
     *
     * @throws RawModeRequiredException when the text uses syntax the structured editor cannot represent
     */
    public BuilderState parse(String text) throws SrqlException {
        Query query = parser.parse(text);
        rejectUnrepresentable(query);

        EntitySchema schema = catalog.resolve(query.getEntity());
        for (FilterClause filter : query.getFilters()) {
            requireField(schema, filter.getField());
        }
        if (query.getSort() != null) {
            requireField(schema, query.getSort().field());
        }
        if (query.getTimeRange() != null) {
            requireTimestamp(schema);
        }

        return BuilderState.builder()
                .entity(schema.getName())
                .filters(FilterAccumulator.accumulate(query.getFilters(), true))
                .time(query.getTimeRange())
                .sort(query.getSort() != null ? query.getSort() : schema.getDefaultSort())
                .limit(config.clampLimit(query.getLimit()))
                .build();
    }

    /**
     * Switching entity invalidates the filters; the time window and limit carry over.
     */
    public BuilderState setEntity(BuilderState state, String entity) throws SrqlException {
        BuilderState fresh = initialState(entity);
        EntitySchema schema = catalog.resolve(fresh.getEntity());
        return fresh.toBuilder()
                .time(schema.getTimestampColumn() != null ? state.getTime() : null)
                .limit(state.getLimit() > 0 ? state.getLimit() : fresh.getLimit())
                .build();
    }

    public BuilderState addFilter(BuilderState state, String field, FilterOperator operator, List<String> values)
            throws SrqlException {
        if (!REPRESENTABLE.contains(operator)) {
            throw new RawModeRequiredException(operator + " filters can only be edited as text");
        }
        requireField(catalog.resolve(state.getEntity()), field);

        FilterClause filter;
        try {
            filter = new FilterClause(field, operator, values);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedExpressionException(e.getMessage());
        }
        List<FilterClause> filters = new ArrayList<>(state.getFilters());
        filters.add(filter);
        return withFilters(state, filters);
    }

    public BuilderState removeFilter(BuilderState state, int index) {
        if (index < 0 || index >= state.getFilters().size()) {
            log.debug("Ignoring removal of filter {} from {} filters", index, state.getFilters().size());
            return state;
        }
        List<FilterClause> filters = new ArrayList<>(state.getFilters());
        filters.remove(index);
        return withFilters(state, filters);
    }

    public BuilderState removeField(BuilderState state, String field) {
        List<FilterClause> filters = state.getFilters().stream()
                .filter(filter -> !filter.getField().equals(field))
                .toList();
        return withFilters(state, filters);
    }

    public BuilderState changeFilter(BuilderState state, int index, FilterClause filter) throws SrqlException {
        if (index < 0 || index >= state.getFilters().size()) {
            log.debug("Ignoring change of filter {} of {} filters", index, state.getFilters().size());
            return state;
        }
        if (!REPRESENTABLE.contains(filter.getOperator())) {
            throw new RawModeRequiredException(filter.getOperator() + " filters can only be edited as text");
        }
        requireField(catalog.resolve(state.getEntity()), filter.getField());

        List<FilterClause> filters = new ArrayList<>(state.getFilters());
        filters.set(index, filter);
        return withFilters(state, filters);
    }

    public BuilderState setTime(BuilderState state, RelativeWindow window) throws SrqlException {
        if (window != null) {
            requireTimestamp(catalog.resolve(state.getEntity()));
        }
        return state.toBuilder().time(window).build();
    }

    public BuilderState setSort(BuilderState state, SortSpec sort) throws SrqlException {
        requireField(catalog.resolve(state.getEntity()), sort.field());
        return state.toBuilder().sort(sort).build();
    }

    public BuilderState setLimit(BuilderState state, int limit) {
        return state.toBuilder().limit(config.clampLimit(limit)).build();
    }

    private static BuilderState withFilters(BuilderState state, List<FilterClause> filters) {
        return state.toBuilder().filters(FilterAccumulator.accumulate(filters, true)).build();
    }

    private static void rejectUnrepresentable(Query query) throws RawModeRequiredException {
        if (query.hasStats()) {
            throw new RawModeRequiredException("stats queries can only be edited as text");
        }
        if (query.getBucket() != null || query.getSeriesBy() != null || query.getAgg() != null) {
            throw new RawModeRequiredException("bucket, series and agg can only be edited as text");
        }
        if (query.getCursor() != null) {
            throw new RawModeRequiredException("cursor can only be edited as text");
        }
        if (query.isStream()) {
            throw new RawModeRequiredException("stream queries can only be edited as text");
        }
        for (FilterClause filter : query.getFilters()) {
            if (!REPRESENTABLE.contains(filter.getOperator())) {
                throw new RawModeRequiredException(
                        "wildcard filter on '" + filter.getField() + "' can only be edited as text");
            }
        }
    }

    private static void requireField(EntitySchema schema, String field) throws UnknownFieldException {
        if (!schema.hasField(field)) {
            throw new UnknownFieldException(schema.getName(), field);
        }
    }

    private static void requireTimestamp(EntitySchema schema) throws UnsupportedExpressionException {
        if (schema.getTimestampColumn() == null) {
            throw new UnsupportedExpressionException("entity '" + schema.getName() + "' has no time column");
        }
    }
}
