package org.carball.srql.pagination;

import lombok.Value;
import org.carball.srql.model.query.PageDirection;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

/**
 * Decoded keyset position: the sort-key tuple of a boundary row, the direction the cursor was
 * issued for, and the fingerprint of the query shape that produced it.
 */
@Value
public class CursorToken {
    Object sortValue;
    Object tieBreakValue;
    PageDirection direction;
    String fingerprint;

    /**
     * Builds a token from row values, widening them to the types a cursor can carry:
     * {@link Long}, {@link Double}, {@link BigDecimal}, {@link Boolean}, {@link Instant} or
     * {@link String}. Decimals stay exact so high-precision numeric sort keys compare correctly.
     */
    public static CursorToken of(Object sortValue, Object tieBreakValue, PageDirection direction, String fingerprint) {
        if (sortValue == null || tieBreakValue == null) {
            throw new IllegalArgumentException("cursor values must not be null");
        }
        return new CursorToken(normalize(sortValue), normalize(tieBreakValue), direction, fingerprint);
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float number) {
            return number.doubleValue();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof Long || value instanceof Double || value instanceof BigDecimal || value instanceof Boolean
                || value instanceof Instant || value instanceof String) {
            return value;
        }
        return value.toString();
    }
}
