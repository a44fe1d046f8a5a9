package org.carball.srql.config;

import java.util.Locale;

/**
 * How bound parameters are written into compiled SQL.
 */
public enum PlaceholderStyle {
    /** PostgreSQL style {@code $1, $2, ...}. */
    DOLLAR_NUMBERED,
    /** JDBC style {@code ?}. */
    JDBC;

    public String render(int index) {
        return this == JDBC ? "?" : "$" + index;
    }

    public static PlaceholderStyle fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "DOLLAR", "DOLLAR_NUMBERED", "POSTGRES" -> DOLLAR_NUMBERED;
            case "JDBC", "QUESTION_MARK" -> JDBC;
            default -> throw new IllegalArgumentException("Unknown placeholder style: " + name);
        };
    }
}
