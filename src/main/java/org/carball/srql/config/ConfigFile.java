package org.carball.srql.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * YAML shape of a configuration file. Absent keys leave the current value unchanged.
 */
@Data
public class ConfigFile {

    @JsonProperty("default_limit")
    private Integer defaultLimit;

    @JsonProperty("max_limit")
    private Integer maxLimit;

    @JsonProperty("strict_limits")
    private Boolean strictLimits;

    @JsonProperty("max_stats_expressions")
    private Integer maxStatsExpressions;

    @JsonProperty("cursor_secret")
    private String cursorSecret;

    @JsonProperty("placeholder_style")
    private String placeholderStyle;

    @JsonProperty("case_insensitive_wildcards")
    private Boolean caseInsensitiveWildcards;

    @JsonProperty("catalog_file")
    private String catalogFile;
}
