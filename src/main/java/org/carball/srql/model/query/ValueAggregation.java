package org.carball.srql.model.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Function applied to an entity's metric value per bucket/series pair ({@code agg:}).
 */
public enum ValueAggregation {
    AVG,
    MIN,
    MAX,
    SUM,
    COUNT;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ValueAggregation> parse(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ValueAggregation aggregation : values()) {
            if (aggregation.name().equals(normalized)) {
                return Optional.of(aggregation);
            }
        }
        return Optional.empty();
    }
}
