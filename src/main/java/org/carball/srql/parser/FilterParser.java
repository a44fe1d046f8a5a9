package org.carball.srql.parser;

import org.carball.srql.error.SrqlSyntaxException;
import org.carball.srql.model.query.Clause;
import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the value part of a field-filter clause into a structured predicate.
 * <ul>
 *   <li>{@code field:v} equality, {@code field:a,b} or {@code field:(a,b)} set membership</li>
 *   <li>{@code field:v%} starts-with, {@code field:%v} ends-with, {@code field:%v%} contains</li>
 *   <li>{@code field:*} non-null</li>
 *   <li>a leading {@code !} on the field inverts the operator</li>
 * </ul>
 * Quoted values are always literal, so {@code field:"50%"} is an equality match.
 */
public final class FilterParser {

    private FilterParser() {
        // Utility class - prevent instantiation
    }

    public static FilterClause parse(Clause clause) throws SrqlSyntaxException {
        FilterClause parsed = parseValue(clause.key(), clause.rawValue(), clause.valueOffset());
        if (clause.negated()) {
            return new FilterClause(parsed.getField(), parsed.getOperator().negate(), parsed.getValues());
        }
        return parsed;
    }

    private static FilterClause parseValue(String field, String raw, int offset) throws SrqlSyntaxException {
        if (raw.startsWith("(")) {
            if (!raw.endsWith(")")) {
                throw new SrqlSyntaxException("unterminated value list for '" + field + "'", offset);
            }
            List<String> values = parseList(field, raw.substring(1, raw.length() - 1), offset + 1);
            return new FilterClause(field, FilterOperator.IN, values);
        }

        if (raw.equals("*")) {
            return new FilterClause(field, FilterOperator.EXISTS, List.of());
        }

        List<QuotedText.Segment> items = QuotedText.splitTopLevel(raw, ',');
        if (items.size() > 1) {
            return new FilterClause(field, FilterOperator.IN, parseItems(field, items, offset));
        }

        return parseScalar(field, raw, offset);
    }

    private static List<String> parseList(String field, String inner, int offset) throws SrqlSyntaxException {
        if (inner.isBlank()) {
            throw new SrqlSyntaxException("empty value list for '" + field + "'", offset);
        }
        return parseItems(field, QuotedText.splitTopLevel(inner, ','), offset);
    }

    private static List<String> parseItems(String field, List<QuotedText.Segment> items, int offset)
            throws SrqlSyntaxException {
        List<String> values = new ArrayList<>(items.size());
        for (QuotedText.Segment item : items) {
            QuotedText.Segment trimmed = item.trimmed();
            if (trimmed.text().isEmpty()) {
                throw new SrqlSyntaxException("empty item in value list for '" + field + "'", offset + item.offset());
            }
            String value = QuotedText.unquote(trimmed.text(), offset + trimmed.offset());
            if (!values.contains(value)) {
                values.add(value);
            }
        }
        return values;
    }

    private static FilterClause parseScalar(String field, String raw, int offset) throws SrqlSyntaxException {
        String core = raw;
        boolean leading = false;
        boolean trailing = false;

        if (core.length() > 1 && core.startsWith("%")) {
            leading = true;
            core = core.substring(1);
        }
        if (core.length() > 1 && core.endsWith("%") && !QuotedText.isQuoted(core)) {
            trailing = true;
            core = core.substring(0, core.length() - 1);
        }
        if (core.equals("%") || core.isEmpty()) {
            throw new SrqlSyntaxException("wildcard for '" + field + "' has no literal part", offset);
        }

        String value = QuotedText.unquote(core, offset + (leading ? 1 : 0));
        FilterOperator operator;
        if (leading && trailing) {
            operator = FilterOperator.WILDCARD_PREFIX_SUFFIX;
        } else if (trailing) {
            operator = FilterOperator.WILDCARD_SUFFIX;
        } else if (leading) {
            operator = FilterOperator.WILDCARD_PREFIX;
        } else {
            operator = FilterOperator.EQ;
        }
        return new FilterClause(field, operator, List.of(value));
    }
}
