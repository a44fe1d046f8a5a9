package org.carball.srql.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.error.DuplicateClauseException;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.UnsupportedExpressionException;
import org.carball.srql.model.query.AggregateExpr;
import org.carball.srql.model.query.AggregateFunction;
import org.carball.srql.model.query.ConditionTerm;
import org.carball.srql.model.query.StatsCondition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code stats:"..."} mini-language: a comma-separated list of
 * {@code <expr> as <alias>}. The grammar is closed:
 * <pre>
 *   count()
 *   sum(field) | avg(field) | min(field) | max(field)
 *   sum(if(field = 'a' OR field = 'b' AND other != 'c', 1, 0))
 * </pre>
 * Anything else is rejected instead of being passed through to SQL.
 */
@Slf4j
public final class StatsExpressionParser {

    private static final Pattern ALIAS_SPLIT = Pattern.compile("(?is)^(.*\\S)\\s+as\\s+(\\S+)$");
    private static final Pattern ALIAS = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final Pattern COUNT = Pattern.compile("(?i)count\\s*\\(\\s*\\*?\\s*\\)");
    private static final Pattern FIELD_AGGREGATE =
            Pattern.compile("(?i)(sum|avg|min|max)\\s*\\(\\s*([a-z_][a-z0-9_.]*)\\s*\\)");
    private static final Pattern SUM_IF = Pattern.compile("(?is)sum\\s*\\(\\s*if\\s*\\((.*)\\)\\s*\\)");

    private StatsExpressionParser() {
        // Utility class - prevent instantiation
    }

    public static List<AggregateExpr> parse(String text, int maxExpressions) throws SrqlException {
        List<String> segments = split(text, ',');
        List<AggregateExpr> expressions = new ArrayList<>();
        Set<String> aliases = new HashSet<>();

        for (String segment : segments) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                throw new UnsupportedExpressionException("empty stats expression");
            }
            if (expressions.size() >= maxExpressions) {
                throw new UnsupportedExpressionException(
                        "stats supports at most " + maxExpressions + " expressions");
            }
            AggregateExpr expression = parseExpression(trimmed);
            if (!aliases.add(expression.getAlias())) {
                throw new DuplicateClauseException(expression.getAlias(),
                        "stats alias '" + expression.getAlias() + "' is used more than once");
            }
            expressions.add(expression);
        }

        if (expressions.isEmpty()) {
            throw new UnsupportedExpressionException("stats requires at least one expression");
        }
        log.trace("Parsed {} stats expressions", expressions.size());
        return List.copyOf(expressions);
    }

    private static AggregateExpr parseExpression(String segment) throws UnsupportedExpressionException {
        Matcher aliasMatcher = ALIAS_SPLIT.matcher(segment);
        if (!aliasMatcher.matches()) {
            throw new UnsupportedExpressionException("stats expression '" + segment + "' must include 'as <alias>'");
        }
        String expression = aliasMatcher.group(1).trim();
        String alias = sanitizeAlias(aliasMatcher.group(2));

        if (COUNT.matcher(expression).matches()) {
            return AggregateExpr.count(alias);
        }

        Matcher fieldAggregate = FIELD_AGGREGATE.matcher(expression);
        if (fieldAggregate.matches()) {
            AggregateFunction function = AggregateFunction.valueOf(fieldAggregate.group(1).toUpperCase(Locale.ROOT));
            return AggregateExpr.of(function, fieldAggregate.group(2).toLowerCase(Locale.ROOT), alias);
        }

        Matcher sumIf = SUM_IF.matcher(expression);
        if (sumIf.matches()) {
            return AggregateExpr.conditionalCount(parseIfArguments(sumIf.group(1), expression), alias);
        }

        throw new UnsupportedExpressionException("unsupported stats expression '" + expression + "'");
    }

    private static String sanitizeAlias(String raw) throws UnsupportedExpressionException {
        String alias = raw;
        if (alias.length() >= 2 && (alias.startsWith("'") && alias.endsWith("'")
                || alias.startsWith("\"") && alias.endsWith("\""))) {
            alias = alias.substring(1, alias.length() - 1);
        }
        alias = alias.trim().toLowerCase(Locale.ROOT);
        if (!ALIAS.matcher(alias).matches()) {
            throw new UnsupportedExpressionException("stats alias '" + raw + "' must be alphanumeric");
        }
        return alias;
    }

    private static StatsCondition parseIfArguments(String arguments, String expression)
            throws UnsupportedExpressionException {
        List<String> parts = split(arguments, ',');
        if (parts.size() != 3 || !parts.get(1).trim().equals("1") || !parts.get(2).trim().equals("0")) {
            throw new UnsupportedExpressionException(
                    "only sum(if(<condition>, 1, 0)) is supported, got '" + expression + "'");
        }
        return parseCondition(parts.get(0).trim());
    }

    static StatsCondition parseCondition(String condition) throws UnsupportedExpressionException {
        List<String> tokens = lexCondition(condition);
        List<List<ConditionTerm>> disjuncts = new ArrayList<>();
        List<ConditionTerm> group = new ArrayList<>();

        int i = 0;
        while (true) {
            if (i + 3 > tokens.size()) {
                throw new UnsupportedExpressionException("incomplete condition '" + condition + "'");
            }
            group.add(term(tokens.get(i), tokens.get(i + 1), tokens.get(i + 2), condition));
            i += 3;
            if (i == tokens.size()) {
                break;
            }
            String connector = tokens.get(i).toUpperCase(Locale.ROOT);
            if (connector.equals("OR")) {
                disjuncts.add(group);
                group = new ArrayList<>();
            } else if (!connector.equals("AND")) {
                throw new UnsupportedExpressionException(
                        "expected AND/OR in condition '" + condition + "' but found '" + tokens.get(i) + "'");
            }
            i++;
        }
        disjuncts.add(group);
        return new StatsCondition(disjuncts);
    }

    private static ConditionTerm term(String field, String operator, String literal, String condition)
            throws UnsupportedExpressionException {
        String normalizedField = field.toLowerCase(Locale.ROOT);
        if (!normalizedField.matches("[a-z_][a-z0-9_.]*") || isKeyword(normalizedField)) {
            throw new UnsupportedExpressionException("expected a field name in condition '" + condition + "'");
        }
        ConditionTerm.Comparator comparator = switch (operator) {
            case "=" -> ConditionTerm.Comparator.EQ;
            case "!=", "<>" -> ConditionTerm.Comparator.NOT_EQ;
            default -> throw new UnsupportedExpressionException(
                    "unsupported comparison '" + operator + "' in condition '" + condition + "'");
        };
        String value;
        if (literal.startsWith("'")) {
            value = literal.substring(1, literal.length() - 1).replace("''", "'");
        } else if (literal.matches("-?\\d+(\\.\\d+)?")) {
            value = literal;
        } else {
            throw new UnsupportedExpressionException(
                    "expected a quoted literal or number in condition '" + condition + "'");
        }
        return new ConditionTerm(normalizedField, comparator, value);
    }

    private static boolean isKeyword(String word) {
        return word.equals("and") || word.equals("or");
    }

    /**
     * Words, comparison operators and single-quoted literals ({@code ''} escapes a quote).
     */
    private static List<String> lexCondition(String condition) throws UnsupportedExpressionException {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < condition.length()) {
            char c = condition.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'') {
                int j = i + 1;
                StringBuilder literal = new StringBuilder("'");
                boolean closed = false;
                while (j < condition.length()) {
                    char d = condition.charAt(j);
                    if (d == '\'') {
                        if (j + 1 < condition.length() && condition.charAt(j + 1) == '\'') {
                            literal.append("''");
                            j += 2;
                            continue;
                        }
                        closed = true;
                        break;
                    }
                    literal.append(d);
                    j++;
                }
                if (!closed) {
                    throw new UnsupportedExpressionException("unterminated literal in condition '" + condition + "'");
                }
                tokens.add(literal.append('\'').toString());
                i = j + 1;
            } else if (c == '=') {
                tokens.add("=");
                i++;
            } else if ((c == '!' || c == '<') && i + 1 < condition.length()
                    && (condition.charAt(i + 1) == '=' || c == '<' && condition.charAt(i + 1) == '>')) {
                tokens.add(condition.substring(i, i + 2));
                i += 2;
            } else if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-') {
                int j = i;
                while (j < condition.length() && (Character.isLetterOrDigit(condition.charAt(j))
                        || "_.-".indexOf(condition.charAt(j)) >= 0)) {
                    j++;
                }
                tokens.add(condition.substring(i, j));
                i = j;
            } else {
                throw new UnsupportedExpressionException(
                        "unexpected '" + c + "' in condition '" + condition + "'");
            }
        }
        if (tokens.isEmpty()) {
            throw new UnsupportedExpressionException("empty condition");
        }
        return tokens;
    }

    /**
     * Splits on a separator outside parentheses and single-quoted literals.
     */
    private static List<String> split(String text, char separator) {
        List<String> items = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '\'') {
                    quoted = false;
                }
            } else if (c == '\'') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                items.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        items.add(current.toString());
        return items;
    }
}
