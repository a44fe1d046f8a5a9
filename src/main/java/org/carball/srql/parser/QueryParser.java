package org.carball.srql.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.error.DuplicateClauseException;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.SrqlSyntaxException;
import org.carball.srql.error.UnsupportedExpressionException;
import org.carball.srql.model.query.BucketInterval;
import org.carball.srql.model.query.Clause;
import org.carball.srql.model.query.ClauseKind;
import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.query.RelativeWindow;
import org.carball.srql.model.query.SortDirection;
import org.carball.srql.model.query.SortSpec;
import org.carball.srql.model.query.ValueAggregation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw SRQL text into a {@link Query}: tokenize, classify, reject repeated single-valued
 * clauses, then parse each clause value. Field names are not checked here.
 */
@Slf4j
public class QueryParser {

    public static final int DEFAULT_MAX_STATS_EXPRESSIONS = 25;

    private static final Pattern FIELD_NAME = Pattern.compile("[a-z_][a-z0-9_.]*");
    private static final Pattern LIMIT_VALUE = Pattern.compile("-?\\d+");

    private final int maxStatsExpressions;

    public QueryParser() {
        this(DEFAULT_MAX_STATS_EXPRESSIONS);
    }

    public QueryParser(int maxStatsExpressions) {
        this.maxStatsExpressions = maxStatsExpressions;
    }

    public Query parse(String text) throws SrqlException {
        List<Clause> clauses = TokenClassifier.classify(Tokenizer.tokenize(text));
        rejectDuplicates(clauses);

        Query.QueryBuilder builder = Query.builder();
        List<FilterClause> filters = new ArrayList<>();
        boolean hasEntity = false;

        for (Clause clause : clauses) {
            switch (clause.kind()) {
                case ENTITY -> {
                    builder.entity(parseEntity(clause));
                    hasEntity = true;
                }
                case TIME -> builder.timeRange(RelativeWindow.parse(unquote(clause), clause.valueOffset()));
                case SORT -> builder.sort(parseSort(clause));
                case LIMIT -> builder.limit(parseLimit(clause));
                case CURSOR -> builder.cursor(unquote(clause));
                case STATS -> builder.stats(StatsExpressionParser.parse(unquote(clause), maxStatsExpressions));
                case BUCKET -> builder.bucket(BucketInterval.parse(unquote(clause), clause.valueOffset()));
                case SERIES -> builder.seriesBy(parseFieldName(unquote(clause), clause));
                case AGG -> builder.agg(parseAgg(clause));
                case STREAM -> builder.stream(parseBoolean(clause));
                case FIELD_FILTER -> filters.add(FilterParser.parse(clause));
            }
        }

        if (!hasEntity) {
            throw new SrqlSyntaxException("query must include in:<entity>", 0);
        }

        Query query = builder.filters(FilterAccumulator.accumulate(filters, false)).build();
        log.debug("Parsed query for entity '{}' with {} filters", query.getEntity(), query.getFilters().size());
        return query;
    }

    private static void rejectDuplicates(List<Clause> clauses) throws DuplicateClauseException {
        Map<ClauseKind, Clause> seen = new EnumMap<>(ClauseKind.class);
        for (Clause clause : clauses) {
            if (clause.kind().isSingleton() && seen.putIfAbsent(clause.kind(), clause) != null) {
                throw new DuplicateClauseException(clause.kind().keyword(), clause.offset());
            }
        }
    }

    private static String unquote(Clause clause) throws SrqlSyntaxException {
        return QuotedText.unquote(clause.rawValue(), clause.valueOffset());
    }

    private static String parseEntity(Clause clause) throws SrqlSyntaxException {
        String entity = unquote(clause).trim().toLowerCase(Locale.ROOT);
        if (entity.isEmpty()) {
            throw new SrqlSyntaxException("missing value for 'in'", clause.valueOffset());
        }
        return entity;
    }

    private static SortSpec parseSort(Clause clause) throws SrqlSyntaxException {
        String value = unquote(clause);
        int colon = value.indexOf(':');
        String field = colon < 0 ? value : value.substring(0, colon);
        SortDirection direction = SortDirection.DESC;
        if (colon >= 0) {
            String rawDirection = value.substring(colon + 1);
            direction = SortDirection.parse(rawDirection)
                    .orElseThrow(() -> new SrqlSyntaxException(
                            "invalid sort direction '" + rawDirection + "', expected asc or desc",
                            clause.valueOffset() + colon + 1));
        }
        return new SortSpec(parseFieldName(field, clause), direction);
    }

    private static Integer parseLimit(Clause clause) throws SrqlSyntaxException {
        String value = clause.rawValue().trim();
        if (!LIMIT_VALUE.matcher(value).matches()) {
            throw new SrqlSyntaxException("limit must be an integer but was '" + value + "'", clause.valueOffset());
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return value.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }

    private static ValueAggregation parseAgg(Clause clause) throws SrqlException {
        String value = unquote(clause);
        return ValueAggregation.parse(value)
                .orElseThrow(() -> new UnsupportedExpressionException(
                        "unsupported agg '" + value + "', expected avg, min, max, sum or count"));
    }

    private static boolean parseBoolean(Clause clause) throws SrqlSyntaxException {
        String value = unquote(clause).trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new SrqlSyntaxException(
                    "stream must be true or false but was '" + value + "'", clause.valueOffset());
        };
    }

    private static String parseFieldName(String raw, Clause clause) throws SrqlSyntaxException {
        String field = raw.trim().toLowerCase(Locale.ROOT);
        if (!FIELD_NAME.matcher(field).matches()) {
            throw new SrqlSyntaxException("invalid field name '" + raw + "'", clause.valueOffset());
        }
        return field;
    }
}
