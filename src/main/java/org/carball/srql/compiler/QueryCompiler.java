package org.carball.srql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.config.SrqlConfig;
import org.carball.srql.error.InvalidCursorException;
import org.carball.srql.error.LimitOutOfRangeException;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.UnknownFieldException;
import org.carball.srql.error.UnsupportedExpressionException;
import org.carball.srql.model.query.AggregateExpr;
import org.carball.srql.model.query.ConditionTerm;
import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;
import org.carball.srql.model.query.PageDirection;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.query.SortDirection;
import org.carball.srql.model.query.SortSpec;
import org.carball.srql.model.query.StatsCondition;
import org.carball.srql.model.query.ValueAggregation;
import org.carball.srql.model.schema.EntitySchema;
import org.carball.srql.model.schema.SchemaCatalog;
import org.carball.srql.pagination.CursorToken;
import org.carball.srql.pagination.QueryShape;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a parsed {@link Query} against an entity catalog into parameterized SQL. Stateless;
 * one instance may be shared between threads.
 */
@Slf4j
public class QueryCompiler {

    private static final String BUCKET_ALIAS = "bucket";
    private static final String VALUE_ALIAS = "value";

    private final SchemaCatalog catalog;
    private final SrqlConfig config;

    public QueryCompiler(SchemaCatalog catalog, SrqlConfig config) {
        this.catalog = catalog;
        this.config = config;
    }

    /**
     * @param query  parsed query; its direction applies when {@code cursor} is present
     * @param cursor decoded cursor, or null for a first page
     */
    public CompiledQuery compile(Query query, CursorToken cursor) throws SrqlException {
        EntitySchema schema = catalog.resolve(query.getEntity());
        validateFields(query, schema);

        int limit = effectiveLimit(query.getLimit());
        SortSpec sort = query.getSort() != null ? query.getSort() : schema.getDefaultSort();
        String fingerprint = QueryShape.fingerprint(schema.getName(), query.getFilters(), sort);

        QueryPlan.QueryPlanBuilder plan = QueryPlan.builder()
                .query(query)
                .schema(schema)
                .sort(sort)
                .limit(limit)
                .stream(query.isStream())
                .fingerprint(fingerprint);

        SqlWriter writer = new SqlWriter(config.getPlaceholderStyle());
        if (query.isAggregate()) {
            if (cursor != null) {
                log.debug("Ignoring cursor for aggregate query on '{}'", schema.getName());
            }
            renderAggregate(writer, query, schema, limit);
            plan.direction(PageDirection.NEXT).fetchLimit(limit).paginated(false);
        } else {
            PageDirection direction = cursor != null ? query.getDirection() : PageDirection.NEXT;
            if (cursor != null && !fingerprint.equals(cursor.getFingerprint())) {
                throw new InvalidCursorException("cursor was issued for a different query");
            }
            renderRows(writer, query, schema, sort, direction, cursor, limit + 1);
            plan.direction(direction).cursor(cursor).fetchLimit(limit + 1).paginated(true);
        }

        CompiledQuery compiled = new CompiledQuery(writer.toSql(), writer.toParams(), plan.build());
        log.debug("Compiled query for '{}': {} filters, {} params, limit {}",
                schema.getName(), query.getFilters().size(), compiled.getParams().size(), limit);
        return compiled;
    }

    int effectiveLimit(Integer requested) throws LimitOutOfRangeException {
        if (config.isStrictLimits() && requested != null && (requested < 1 || requested > config.getMaxLimit())) {
            throw new LimitOutOfRangeException(requested, config.getMaxLimit());
        }
        return config.clampLimit(requested);
    }

    private void validateFields(Query query, EntitySchema schema) throws SrqlException {
        for (FilterClause filter : query.getFilters()) {
            requireField(schema, filter.getField());
        }
        if (query.getSort() != null) {
            requireField(schema, query.getSort().field());
        }
        if (query.getSeriesBy() != null) {
            requireField(schema, query.getSeriesBy());
        }
        for (AggregateExpr expr : query.getStats()) {
            if (expr.getField() != null) {
                requireField(schema, expr.getField());
            }
            if (expr.getCondition() != null) {
                for (ConditionTerm term : expr.getCondition().terms()) {
                    requireField(schema, term.field());
                }
            }
        }
        if ((query.getTimeRange() != null || query.getBucket() != null) && schema.getTimestampColumn() == null) {
            throw new UnsupportedExpressionException(
                    "entity '" + schema.getName() + "' has no timestamp column for time filters or buckets");
        }
        if (query.getAgg() != null) {
            if (query.hasStats()) {
                throw new UnsupportedExpressionException("agg cannot be combined with stats");
            }
            if (!schema.isMetric()) {
                throw new UnsupportedExpressionException(
                        "agg requires a metric entity, '" + schema.getName() + "' has no value column");
            }
        }
    }

    private static void requireField(EntitySchema schema, String field) throws UnknownFieldException {
        if (!schema.hasField(field)) {
            throw new UnknownFieldException(schema.getName(), field);
        }
    }

    private void renderRows(SqlWriter writer, Query query, EntitySchema schema, SortSpec sort,
                            PageDirection direction, CursorToken cursor, int fetchLimit) {
        // prev pages scan the other way and are reversed after fetch
        SortDirection scan = direction == PageDirection.PREV ? sort.direction().reverse() : sort.direction();
        String tieBreak = schema.getTieBreakColumn();
        boolean separateTieBreak = !tieBreak.equals(sort.field());

        writer.sql("SELECT ");
        if (query.getBucket() != null) {
            writer.sql(bucketExpression(query, schema)).sql(" AS ").sql(BUCKET_ALIAS).sql(", ");
        }
        writer.sql(String.join(", ", schema.getFields()));
        writer.sql(" FROM ").sql(schema.getTable());

        List<Runnable> extra = new ArrayList<>();
        if (cursor != null) {
            String comparison = scan == SortDirection.DESC ? " < " : " > ";
            extra.add(() -> {
                if (separateTieBreak) {
                    writer.sql("(").sql(sort.field()).sql(", ").sql(tieBreak).sql(")").sql(comparison).sql("(")
                            .param(cursor.getSortValue()).sql(", ").param(cursor.getTieBreakValue()).sql(")");
                } else {
                    writer.sql(sort.field()).sql(comparison).param(cursor.getSortValue());
                }
            });
        }
        renderWhere(writer, query, schema, extra);

        String keyword = scan == SortDirection.DESC ? "DESC" : "ASC";
        writer.sql(" ORDER BY ").sql(sort.field()).sql(" ").sql(keyword);
        if (separateTieBreak) {
            writer.sql(", ").sql(tieBreak).sql(" ").sql(keyword);
        }
        writer.sql(" LIMIT ").sql(Integer.toString(fetchLimit));
    }

    private void renderAggregate(SqlWriter writer, Query query, EntitySchema schema, int limit) {
        List<String> groupBy = new ArrayList<>();
        writer.sql("SELECT ");
        if (query.getSeriesBy() != null) {
            writer.sql(query.getSeriesBy()).sql(", ");
            groupBy.add(query.getSeriesBy());
        }
        if (query.getBucket() != null) {
            writer.sql(bucketExpression(query, schema)).sql(" AS ").sql(BUCKET_ALIAS).sql(", ");
            groupBy.add(BUCKET_ALIAS);
        }

        if (query.hasStats()) {
            List<AggregateExpr> stats = query.getStats();
            for (int i = 0; i < stats.size(); i++) {
                if (i > 0) {
                    writer.sql(", ");
                }
                renderAggregateExpr(writer, stats.get(i));
            }
        } else {
            String function = query.getAgg().keyword().toUpperCase(Locale.ROOT);
            String argument = query.getAgg() == ValueAggregation.COUNT
                    ? "*" : schema.getValueColumn();
            writer.sql(function).sql("(").sql(argument).sql(") AS ").sql(VALUE_ALIAS);
        }

        writer.sql(" FROM ").sql(schema.getTable());
        renderWhere(writer, query, schema, List.of());

        if (!groupBy.isEmpty()) {
            writer.sql(" GROUP BY ").sql(String.join(", ", groupBy));
            List<String> orderBy = new ArrayList<>();
            if (query.getBucket() != null) {
                orderBy.add(BUCKET_ALIAS + " ASC");
            }
            if (query.getSeriesBy() != null) {
                orderBy.add(query.getSeriesBy() + " ASC");
            }
            writer.sql(" ORDER BY ").sql(String.join(", ", orderBy));
        }
        writer.sql(" LIMIT ").sql(Integer.toString(limit));
    }

    private void renderAggregateExpr(SqlWriter writer, AggregateExpr expr) {
        switch (expr.getFunction()) {
            case COUNT -> writer.sql("COUNT(*)");
            case SUM -> writer.sql("SUM(").sql(expr.getField()).sql(")");
            case AVG -> writer.sql("AVG(").sql(expr.getField()).sql(")");
            case MIN -> writer.sql("MIN(").sql(expr.getField()).sql(")");
            case MAX -> writer.sql("MAX(").sql(expr.getField()).sql(")");
            case CONDITIONAL_COUNT -> {
                writer.sql("COALESCE(SUM(CASE WHEN ");
                renderCondition(writer, expr.getCondition());
                writer.sql(" THEN 1 ELSE 0 END), 0)");
            }
        }
        writer.sql(" AS ").sql(expr.getAlias());
    }

    private void renderCondition(SqlWriter writer, StatsCondition condition) {
        List<List<ConditionTerm>> disjuncts = condition.disjuncts();
        writer.sql("(");
        for (int i = 0; i < disjuncts.size(); i++) {
            if (i > 0) {
                writer.sql(" OR ");
            }
            List<ConditionTerm> group = disjuncts.get(i);
            boolean wrap = group.size() > 1 && disjuncts.size() > 1;
            if (wrap) {
                writer.sql("(");
            }
            for (int j = 0; j < group.size(); j++) {
                if (j > 0) {
                    writer.sql(" AND ");
                }
                ConditionTerm term = group.get(j);
                writer.sql(term.field()).sql(" ").sql(term.comparator().sql()).sql(" ").param(term.literal());
            }
            if (wrap) {
                writer.sql(")");
            }
        }
        writer.sql(")");
    }

    private String bucketExpression(Query query, EntitySchema schema) {
        return "time_bucket(interval '" + query.getBucket().toSqlInterval() + "', "
                + schema.getTimestampColumn() + ")";
    }

    /**
     * Filters on the same field: positive clauses are ORed, negative clauses ANDed. Different
     * fields, the time window and {@code extra} predicates are ANDed.
     */
    private void renderWhere(SqlWriter writer, Query query, EntitySchema schema, List<Runnable> extra) {
        Map<String, List<FilterClause>> byField = new LinkedHashMap<>();
        for (FilterClause filter : query.getFilters()) {
            byField.computeIfAbsent(filter.getField(), f -> new ArrayList<>()).add(filter);
        }

        List<Runnable> predicates = new ArrayList<>();
        for (List<FilterClause> clauses : byField.values()) {
            List<FilterClause> positive = clauses.stream().filter(c -> !c.getOperator().isNegative()).toList();
            if (positive.size() == 1) {
                predicates.add(() -> renderFilter(writer, positive.get(0)));
            } else if (positive.size() > 1) {
                predicates.add(() -> {
                    writer.sql("(");
                    for (int i = 0; i < positive.size(); i++) {
                        if (i > 0) {
                            writer.sql(" OR ");
                        }
                        renderFilter(writer, positive.get(i));
                    }
                    writer.sql(")");
                });
            }
            clauses.stream()
                    .filter(c -> c.getOperator().isNegative())
                    .forEach(c -> predicates.add(() -> renderFilter(writer, c)));
        }

        if (query.getTimeRange() != null) {
            String interval = query.getTimeRange().toSqlInterval();
            predicates.add(() -> writer.sql(schema.getTimestampColumn())
                    .sql(" >= now() - interval '").sql(interval).sql("'"));
        }
        predicates.addAll(extra);

        for (int i = 0; i < predicates.size(); i++) {
            writer.sql(i == 0 ? " WHERE " : " AND ");
            predicates.get(i).run();
        }
    }

    private void renderFilter(SqlWriter writer, FilterClause filter) {
        String field = filter.getField();
        FilterOperator operator = filter.getOperator();
        String like = config.isCaseInsensitiveWildcards() ? "ILIKE" : "LIKE";

        switch (operator) {
            case EQ -> writer.sql(field).sql(" = ").param(filter.getValue());
            case NOT_EQ -> writer.sql(field).sql(" <> ").param(filter.getValue());
            case IN -> writer.sql(field).sql(" IN (").params(filter.getValues()).sql(")");
            case NOT_IN -> writer.sql(field).sql(" NOT IN (").params(filter.getValues()).sql(")");
            case EXISTS -> writer.sql(field).sql(" IS NOT NULL");
            case NOT_EXISTS -> writer.sql(field).sql(" IS NULL");
            default -> writer.sql(field).sql(operator.isNegative() ? " NOT " : " ").sql(like).sql(" ")
                    .param(likePattern(operator, filter.getValue()));
        }
    }

    static String likePattern(FilterOperator operator, String value) {
        if (!operator.isWildcard()) {
            throw new IllegalArgumentException("Not a wildcard operator: " + operator);
        }
        String escaped = value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        FilterOperator positive = operator.isNegative() ? operator.negate() : operator;
        return switch (positive) {
            case WILDCARD_SUFFIX -> escaped + "%";
            case WILDCARD_PREFIX -> "%" + escaped;
            default -> "%" + escaped + "%";
        };
    }
}
