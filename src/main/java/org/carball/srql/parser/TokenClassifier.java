package org.carball.srql.parser;

import org.carball.srql.error.SrqlSyntaxException;
import org.carball.srql.model.query.Clause;
import org.carball.srql.model.query.ClauseKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps {@code key:value} tokens to clause kinds by their key.
 */
public final class TokenClassifier {

    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z_][a-z0-9_.]*");

    private TokenClassifier() {
        // Utility class - prevent instantiation
    }

    public static List<Clause> classify(List<Token> tokens) throws SrqlSyntaxException {
        List<Clause> clauses = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            clauses.add(classify(token));
        }
        return clauses;
    }

    public static Clause classify(Token token) throws SrqlSyntaxException {
        String text = token.text();
        int colon = text.indexOf(':');
        int quote = text.indexOf('"');

        if (colon < 0 || (quote >= 0 && quote < colon)) {
            throw new SrqlSyntaxException("expected <key>:<value> but found '" + text + "'", token.offset());
        }

        String key = text.substring(0, colon);
        boolean negated = key.startsWith("!");
        if (negated) {
            key = key.substring(1);
        }
        key = key.toLowerCase(Locale.ROOT);

        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new SrqlSyntaxException("invalid key '" + text.substring(0, colon) + "'", token.offset());
        }

        int valueOffset = token.offset() + colon + 1;
        String value = text.substring(colon + 1);
        if (value.isEmpty()) {
            throw new SrqlSyntaxException("missing value for '" + key + "'", valueOffset);
        }

        ClauseKind kind = ClauseKind.forKeyword(key).orElse(ClauseKind.FIELD_FILTER);
        if (negated && kind != ClauseKind.FIELD_FILTER) {
            throw new SrqlSyntaxException("'" + key + "' cannot be negated", token.offset());
        }
        return new Clause(kind, key, value, negated, token.offset(), valueOffset);
    }
}
