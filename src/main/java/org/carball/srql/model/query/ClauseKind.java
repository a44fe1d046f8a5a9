package org.carball.srql.model.query;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of clause kinds a token can be classified as. Any key that is not one of the
 * reserved keywords is a field filter; whether that field exists is decided later against the
 * entity schema.
 */
public enum ClauseKind {
    ENTITY("in"),
    TIME("time", "timeframe"),
    SORT("sort", "order"),
    LIMIT("limit"),
    CURSOR("cursor"),
    STATS("stats"),
    BUCKET("bucket"),
    SERIES("series"),
    AGG("agg"),
    STREAM("stream"),
    FIELD_FILTER();

    private final List<String> keywords;

    ClauseKind(String... keywords) {
        this.keywords = List.of(keywords);
    }

    /**
     * Canonical keyword used when serializing and in error messages.
     */
    public String keyword() {
        return keywords.isEmpty() ? "field" : keywords.get(0);
    }

    /**
     * Everything except field filters may appear at most once per query.
     */
    public boolean isSingleton() {
        return this != FIELD_FILTER;
    }

    public static Optional<ClauseKind> forKeyword(String key) {
        String normalized = key.toLowerCase(Locale.ROOT);
        for (ClauseKind kind : values()) {
            if (kind.keywords.contains(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
