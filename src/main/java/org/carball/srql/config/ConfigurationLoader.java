package org.carball.srql.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > config file > defaults
     */
    public SrqlConfig loadConfiguration(String[] args) throws IOException {
        log.debug("Loading configuration");

        // Start with defaults
        SrqlConfig.SrqlConfigBuilder builder = SrqlConfig.builder();

        // 1. Apply configuration file, if one is named
        String configFile = findConfigFile(args);
        if (configFile != null) {
            applyConfigFile(builder, Path.of(configFile));
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        SrqlConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private String findConfigFile(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return environment.get("SRQL_CONFIG_FILE");
    }

    void applyConfigFile(SrqlConfig.SrqlConfigBuilder builder, Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }

        ConfigFile values;
        try (InputStream in = Files.newInputStream(file)) {
            values = yamlMapper.readValue(in, ConfigFile.class);
        }
        if (values == null) {
            log.warn("Configuration file {} is empty", file);
            return;
        }
        log.debug("Applying configuration file {}", file);

        if (values.getDefaultLimit() != null) {
            builder.defaultLimit(values.getDefaultLimit());
        }
        if (values.getMaxLimit() != null) {
            builder.maxLimit(values.getMaxLimit());
        }
        if (values.getStrictLimits() != null) {
            builder.strictLimits(values.getStrictLimits());
        }
        if (values.getMaxStatsExpressions() != null) {
            builder.maxStatsExpressions(values.getMaxStatsExpressions());
        }
        if (values.getCursorSecret() != null) {
            builder.cursorSecret(values.getCursorSecret());
        }
        if (values.getPlaceholderStyle() != null) {
            applyPlaceholderStyle(builder, "placeholder_style", values.getPlaceholderStyle());
        }
        if (values.getCaseInsensitiveWildcards() != null) {
            builder.caseInsensitiveWildcards(values.getCaseInsensitiveWildcards());
        }
        if (values.getCatalogFile() != null) {
            builder.catalogFile(values.getCatalogFile());
        }
    }

    private void applyEnvironmentVariables(SrqlConfig.SrqlConfigBuilder builder) {
        Map<String, String> env = environment;

        try {
            if (env.containsKey("SRQL_DEFAULT_LIMIT")) {
                builder.defaultLimit(Integer.parseInt(env.get("SRQL_DEFAULT_LIMIT")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", "SRQL_DEFAULT_LIMIT", env.get("SRQL_DEFAULT_LIMIT"));
        }
        try {
            if (env.containsKey("SRQL_MAX_LIMIT")) {
                builder.maxLimit(Integer.parseInt(env.get("SRQL_MAX_LIMIT")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", "SRQL_MAX_LIMIT", env.get("SRQL_MAX_LIMIT"));
        }
        if (env.containsKey("SRQL_STRICT_LIMITS")) {
            builder.strictLimits(Boolean.parseBoolean(env.get("SRQL_STRICT_LIMITS")));
        }
        if (env.containsKey("SRQL_CURSOR_SECRET")) {
            builder.cursorSecret(env.get("SRQL_CURSOR_SECRET"));
        }
        if (env.containsKey("SRQL_PLACEHOLDER_STYLE")) {
            applyPlaceholderStyle(builder, "SRQL_PLACEHOLDER_STYLE", env.get("SRQL_PLACEHOLDER_STYLE"));
        }
        if (env.containsKey("SRQL_CASE_INSENSITIVE_WILDCARDS")) {
            builder.caseInsensitiveWildcards(Boolean.parseBoolean(env.get("SRQL_CASE_INSENSITIVE_WILDCARDS")));
        }
        if (env.containsKey("SRQL_CATALOG_FILE")) {
            builder.catalogFile(env.get("SRQL_CATALOG_FILE"));
        }
    }

    private void applyCLIArguments(SrqlConfig.SrqlConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--srql.default-limit":
                        builder.defaultLimit(Integer.parseInt(value));
                        break;
                    case "--srql.max-limit":
                        builder.maxLimit(Integer.parseInt(value));
                        break;
                    case "--srql.strict-limits":
                        builder.strictLimits(Boolean.parseBoolean(value));
                        break;
                    case "--srql.max-stats-expressions":
                        builder.maxStatsExpressions(Integer.parseInt(value));
                        break;
                    case "--srql.cursor-secret":
                        builder.cursorSecret(value);
                        break;
                    case "--srql.placeholder-style":
                        applyPlaceholderStyle(builder, arg, value);
                        break;
                    case "--srql.case-insensitive-wildcards":
                        builder.caseInsensitiveWildcards(Boolean.parseBoolean(value));
                        break;
                    case "--srql.catalog":
                    case "--catalog":
                        builder.catalogFile(value);
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private void applyPlaceholderStyle(SrqlConfig.SrqlConfigBuilder builder, String source, String value) {
        try {
            builder.placeholderStyle(PlaceholderStyle.fromName(value));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid placeholder style for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config <file>                        YAML configuration file
              --srql.default-limit <num>             Rows per page when no limit is given
              --srql.max-limit <num>                 Upper bound for limits
              --srql.strict-limits <true|false>      Reject out-of-range limits instead of clamping
              --srql.max-stats-expressions <num>     Expressions allowed in one stats clause
              --srql.cursor-secret <secret>          Key used to sign pagination cursors
              --srql.placeholder-style <dollar|jdbc> Parameter placeholders in compiled SQL
              --srql.case-insensitive-wildcards <b>  Render wildcards as ILIKE
              --catalog <file>                       Entity catalog (YAML or SQL DDL)

            Environment Variables:
              SRQL_CONFIG_FILE                       Same as --config
              SRQL_DEFAULT_LIMIT                     Same as --srql.default-limit
              SRQL_MAX_LIMIT                         Same as --srql.max-limit
              SRQL_STRICT_LIMITS                     Same as --srql.strict-limits
              SRQL_CURSOR_SECRET                     Same as --srql.cursor-secret
              SRQL_PLACEHOLDER_STYLE                 Same as --srql.placeholder-style
              SRQL_CASE_INSENSITIVE_WILDCARDS        Same as --srql.case-insensitive-wildcards
              SRQL_CATALOG_FILE                      Same as --catalog

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
