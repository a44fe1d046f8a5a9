package org.carball.srql.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.srql.model.query.SortDirection;
import org.carball.srql.model.schema.EntitySchema;
import org.carball.srql.model.schema.SchemaCatalog;
import org.carball.srql.parser.SchemaParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the entity catalog from YAML (the bundled {@code srql-catalog.yaml} or a file of the
 * same shape) or from SQL DDL.
 */
@Slf4j
public class CatalogLoader {

    public static final String BUNDLED_CATALOG = "srql-catalog.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Catalog shipped on the classpath.
     */
    public SchemaCatalog loadBundled() throws IOException {
        try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(BUNDLED_CATALOG)) {
            if (in == null) {
                throw new IOException("Bundled catalog " + BUNDLED_CATALOG + " not found on classpath");
            }
            return load(in);
        }
    }

    /**
     * Loads a {@code .sql}/{@code .ddl} file through the DDL parser, anything else as YAML.
     */
    public SchemaCatalog load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Catalog file not found: " + file);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        log.info("Loading entity catalog from {}", file);
        if (name.endsWith(".sql") || name.endsWith(".ddl")) {
            return SchemaParser.parseDDL(file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public SchemaCatalog load(InputStream in) throws IOException {
        CatalogFile file = yamlMapper.readValue(in, CatalogFile.class);
        if (file.getEntities() == null || file.getEntities().isEmpty()) {
            throw new IllegalArgumentException("Catalog defines no entities");
        }

        List<EntitySchema> schemas = new ArrayList<>();
        for (EntityDefinition definition : file.getEntities()) {
            schemas.add(definition.toSchema());
        }
        SchemaCatalog catalog = SchemaCatalog.of(schemas);
        log.debug("Loaded {} entities", schemas.size());
        return catalog;
    }

    @Data
    public static class CatalogFile {
        private List<EntityDefinition> entities = new ArrayList<>();
    }

    @Data
    public static class EntityDefinition {
        private String name;

        private String table;

        private List<String> aliases = new ArrayList<>();

        private List<String> fields = new ArrayList<>();

        @JsonProperty("timestamp_column")
        private String timestampColumn;

        @JsonProperty("tie_break_column")
        private String tieBreakColumn;

        @JsonProperty("default_sort_field")
        private String defaultSortField;

        @JsonProperty("default_sort_direction")
        private String defaultSortDirection = "desc";

        @JsonProperty("value_column")
        private String valueColumn;

        EntitySchema toSchema() {
            SortDirection direction = SortDirection.parse(defaultSortDirection)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Entity '" + name + "' has invalid default_sort_direction: " + defaultSortDirection));
            return EntitySchema.builder()
                    .name(name)
                    .table(table != null ? table : name)
                    .aliases(aliases)
                    .fields(fields.stream().map(f -> f.toLowerCase(Locale.ROOT)).toList())
                    .timestampColumn(timestampColumn)
                    .tieBreakColumn(tieBreakColumn)
                    .defaultSortField(defaultSortField != null ? defaultSortField : timestampColumn)
                    .defaultSortDirection(direction)
                    .valueColumn(valueColumn)
                    .build();
        }
    }
}
