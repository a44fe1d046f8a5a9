package org.carball.srql.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class SrqlConfig {

    public static final String DEVELOPMENT_CURSOR_SECRET = "srql-development-cursor-secret";

    // Limits
    @Builder.Default
    private int defaultLimit = 100;

    @Builder.Default
    private int maxLimit = 500;

    @Builder.Default
    private boolean strictLimits = false;

    // Stats
    @Builder.Default
    private int maxStatsExpressions = 25;

    // Cursor signing
    @Builder.Default
    private String cursorSecret = DEVELOPMENT_CURSOR_SECRET;

    // SQL rendering
    @Builder.Default
    private PlaceholderStyle placeholderStyle = PlaceholderStyle.DOLLAR_NUMBERED;

    @Builder.Default
    private boolean caseInsensitiveWildcards = false;

    private String catalogFile;

    public static SrqlConfig defaults() {
        return SrqlConfig.builder().build();
    }

    /**
     * Clamps a requested limit into {@code [1, maxLimit]}; null means the default limit.
     */
    public int clampLimit(Integer requested) {
        int limit = requested == null ? defaultLimit : requested;
        return Math.max(1, Math.min(limit, Math.max(1, maxLimit)));
    }

    /**
     * Validates the configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (maxLimit < 1) {
            log.warn("Max limit ({}) should be at least 1; queries will be limited to 1 row", maxLimit);
        }

        if (defaultLimit > maxLimit) {
            log.warn("Default limit ({}) is greater than max limit ({}); it will be clamped",
                    defaultLimit, maxLimit);
        }

        if (defaultLimit < 1) {
            log.warn("Default limit ({}) should be positive", defaultLimit);
        }

        if (maxStatsExpressions < 1) {
            log.warn("Max stats expressions ({}) should be positive; every stats clause will be rejected",
                    maxStatsExpressions);
        }

        if (cursorSecret == null || cursorSecret.isBlank() || DEVELOPMENT_CURSOR_SECRET.equals(cursorSecret)) {
            log.warn("Using the built-in development cursor secret; set SRQL_CURSOR_SECRET in production");
        }

        log.debug("Configuration validation completed");
    }

    public String getConfigurationSummary() {
        return String.format(
                "Limits: default=%d, max=%d, strict=%s | Stats: maxExpressions=%d | SQL: placeholders=%s, ilike=%s | Catalog: %s",
                defaultLimit, maxLimit, strictLimits, maxStatsExpressions,
                placeholderStyle, caseInsensitiveWildcards,
                catalogFile != null ? catalogFile : "bundled");
    }
}
