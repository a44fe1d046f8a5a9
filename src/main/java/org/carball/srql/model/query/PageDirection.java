package org.carball.srql.model.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Direction a page is requested in relative to the cursor.
 */
public enum PageDirection {
    NEXT,
    PREV;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PageDirection> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "next", "forward" -> Optional.of(NEXT);
            case "prev", "previous", "backward" -> Optional.of(PREV);
            default -> Optional.empty();
        };
    }
}
