package org.carball.srql.model.query;

import java.util.Locale;
import java.util.Optional;

public enum SortDirection {
    ASC,
    DESC;

    public SortDirection reverse() {
        return this == ASC ? DESC : ASC;
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SortDirection> parse(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> Optional.of(ASC);
            case "desc" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }
}
