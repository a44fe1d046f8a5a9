package org.carball.srql.parser;

import org.carball.srql.error.SrqlSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Quoting helpers shared by the value parsers and the serializer.
 */
public final class QuotedText {

    private QuotedText() {
        // Utility class - prevent instantiation
    }

    public static boolean isQuoted(String raw) {
        return raw.length() >= 2 && raw.charAt(0) == '"' && raw.charAt(raw.length() - 1) == '"';
    }

    /**
     * Strips surrounding double quotes and resolves {@code \\} and {@code \"}. Unquoted text is
     * returned as-is, but may not contain a stray quote.
     */
    public static String unquote(String raw, int offset) throws SrqlSyntaxException {
        if (raw.startsWith("\"")) {
            if (!isQuoted(raw) || endsInEscapedQuote(raw)) {
                throw new SrqlSyntaxException("unterminated quote", offset);
            }
            return unescape(raw.substring(1, raw.length() - 1));
        }
        int stray = raw.indexOf('"');
        if (stray >= 0) {
            throw new SrqlSyntaxException("unexpected quote in unquoted value", offset + stray);
        }
        return raw;
    }

    public static String unescape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '\\' || next == '"') {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Quotes a value unless it consists only of characters that carry no meaning in SRQL.
     */
    public static String quoteIfNeeded(String value) {
        if (value.isEmpty()) {
            return quote(value);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isLetterOrDigit(c) && "_.-@/+".indexOf(c) < 0) {
                return quote(value);
            }
        }
        return value;
    }

    /**
     * Splits on commas outside double quotes. Items keep their quotes; offsets are relative to
     * the start of {@code text}.
     */
    public static List<Segment> splitTopLevel(String text, char separator) {
        List<Segment> items = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int start = 0;
        boolean quoted = false;
        boolean escape = false;
        int depth = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (escape) {
                    escape = false;
                } else if (c == '\\') {
                    escape = true;
                } else if (c == '"') {
                    quoted = false;
                }
                current.append(c);
                continue;
            }
            if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                items.add(new Segment(current.toString(), start));
                current.setLength(0);
                start = i + 1;
                continue;
            }
            current.append(c);
        }
        items.add(new Segment(current.toString(), start));
        return items;
    }

    private static boolean endsInEscapedQuote(String raw) {
        int backslashes = 0;
        for (int i = raw.length() - 2; i >= 1 && raw.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    public record Segment(String text, int offset) {

        /**
         * Trimmed text, with the offset moved past any leading whitespace.
         */
        public Segment trimmed() {
            int lead = 0;
            while (lead < text.length() && Character.isWhitespace(text.charAt(lead))) {
                lead++;
            }
            return new Segment(text.trim(), offset + lead);
        }
    }
}
