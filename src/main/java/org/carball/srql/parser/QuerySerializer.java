package org.carball.srql.parser;

import org.carball.srql.model.query.AggregateExpr;
import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;
import org.carball.srql.model.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a {@link Query} back as canonical SRQL. Values are quoted only when they contain
 * characters that would otherwise be read as syntax.
 */
public final class QuerySerializer {

    private QuerySerializer() {
        // Utility class - prevent instantiation
    }

    public static String serialize(Query query) {
        List<String> tokens = new ArrayList<>();
        tokens.add("in:" + QuotedText.quoteIfNeeded(query.getEntity()));
        if (query.getTimeRange() != null) {
            tokens.add("time:" + query.getTimeRange().getName());
        }
        for (FilterClause filter : query.getFilters()) {
            tokens.add(serializeFilter(filter));
        }
        if (query.getSort() != null) {
            tokens.add("sort:" + query.getSort().toSrql());
        }
        if (query.getLimit() != null) {
            tokens.add("limit:" + query.getLimit());
        }
        if (query.hasStats()) {
            String stats = query.getStats().stream().map(AggregateExpr::toSrql).collect(Collectors.joining(", "));
            tokens.add("stats:" + QuotedText.quote(stats));
        }
        if (query.getBucket() != null) {
            tokens.add("bucket:" + query.getBucket().getText());
        }
        if (query.getSeriesBy() != null) {
            tokens.add("series:" + query.getSeriesBy());
        }
        if (query.getAgg() != null) {
            tokens.add("agg:" + query.getAgg().keyword());
        }
        if (query.isStream()) {
            tokens.add("stream:true");
        }
        if (query.getCursor() != null) {
            tokens.add("cursor:" + QuotedText.quoteIfNeeded(query.getCursor()));
        }
        return String.join(" ", tokens);
    }

    public static String serializeFilter(FilterClause filter) {
        FilterOperator operator = filter.getOperator();
        String prefix = (operator.isNegative() ? "!" : "") + filter.getField() + ":";
        FilterOperator positive = operator.isNegative() ? operator.negate() : operator;

        return prefix + switch (positive) {
            case EXISTS -> "*";
            case IN -> "(" + filter.getValues().stream()
                    .map(QuotedText::quoteIfNeeded)
                    .collect(Collectors.joining(",")) + ")";
            case WILDCARD_SUFFIX -> QuotedText.quoteIfNeeded(filter.getValue()) + "%";
            case WILDCARD_PREFIX -> "%" + QuotedText.quoteIfNeeded(filter.getValue());
            case WILDCARD_PREFIX_SUFFIX -> "%" + QuotedText.quoteIfNeeded(filter.getValue()) + "%";
            default -> QuotedText.quoteIfNeeded(filter.getValue());
        };
    }
}
