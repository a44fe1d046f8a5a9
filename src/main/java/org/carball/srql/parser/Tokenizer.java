package org.carball.srql.parser;

import org.carball.srql.error.SrqlSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw query on unquoted whitespace. Double-quoted spans (with {@code \"} and
 * {@code \\} escapes) and parenthesised lists stay inside a single token. Quotes and escapes
 * are kept verbatim; value parsers unescape them.
 */
public final class Tokenizer {

    private Tokenizer() {
        // Utility class - prevent instantiation
    }

    public static List<Token> tokenize(String input) throws SrqlSyntaxException {
        List<Token> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        int tokenStart = -1;
        int quoteStart = -1;
        int depth = 0;
        int parenStart = -1;
        boolean escape = false;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);

            if (quoteStart >= 0) {
                current.append(c);
                if (escape) {
                    escape = false;
                } else if (c == '\\') {
                    escape = true;
                } else if (c == '"') {
                    quoteStart = -1;
                }
                continue;
            }

            if (Character.isWhitespace(c) && depth == 0) {
                if (tokenStart >= 0) {
                    tokens.add(new Token(current.toString(), tokenStart));
                    current.setLength(0);
                    tokenStart = -1;
                }
                continue;
            }

            if (tokenStart < 0) {
                tokenStart = i;
            }

            switch (c) {
                case '"' -> quoteStart = i;
                case '(' -> {
                    if (depth == 0) {
                        parenStart = i;
                    }
                    depth++;
                }
                case ')' -> {
                    if (depth == 0) {
                        throw new SrqlSyntaxException("unbalanced ')'", i);
                    }
                    depth--;
                }
                default -> {
                    // literal character
                }
            }
            current.append(c);
        }

        if (quoteStart >= 0) {
            throw new SrqlSyntaxException("unterminated quote", quoteStart);
        }
        if (depth > 0) {
            throw new SrqlSyntaxException("unterminated '('", parenStart);
        }
        if (tokenStart >= 0) {
            tokens.add(new Token(current.toString(), tokenStart));
        }
        return tokens;
    }
}
