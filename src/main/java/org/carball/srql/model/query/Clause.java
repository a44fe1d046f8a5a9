package org.carball.srql.model.query;

/**
 * A classified token.
 *
 * @param kind        clause kind
 * @param key         lowercased key; the field name for field filters
 * @param rawValue    value text after the first colon, still quoted/escaped
 * @param negated     true when the key carried a leading {@code !}
 * @param offset      offset of the token in the raw query
 * @param valueOffset offset of {@code rawValue} in the raw query
 */
public record Clause(ClauseKind kind, String key, String rawValue, boolean negated, int offset, int valueOffset) {
}
