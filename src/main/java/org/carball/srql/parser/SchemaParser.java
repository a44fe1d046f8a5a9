package org.carball.srql.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.srql.model.schema.EntitySchema;
import org.carball.srql.model.schema.SchemaCatalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds entity schemas from {@code CREATE TABLE} DDL. Each table becomes an entity named after
 * the table; its columns become the field allow-list, the primary key supplies the tie-break
 * column and the first timestamp-typed column the time column.
 */
@Slf4j
public class SchemaParser {

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "DOUBLE", "FLOAT", "REAL", "NUMERIC", "DECIMAL", "INT", "INTEGER", "BIGINT", "FLOAT8", "FLOAT4");

    private SchemaParser() {
        // Utility class - prevent instantiation
    }

    public static SchemaCatalog parseDDL(Path ddlFile) throws IOException {
        String content = Files.readString(ddlFile);
        return parseDDL(content);
    }

    public static SchemaCatalog parseDDL(String ddlContent) {
        List<EntitySchema> schemas = new ArrayList<>();

        try {
            Statements statements = CCJSqlParserUtil.parseStatements(preprocessDDL(ddlContent));
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    EntitySchema schema = convertTable(createTable);
                    schemas.add(schema);
                    log.debug("Parsed entity '{}' with {} fields", schema.getName(), schema.getFields().size());
                }
            }
        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        if (schemas.isEmpty()) {
            throw new IllegalArgumentException("DDL contains no CREATE TABLE statements");
        }
        return SchemaCatalog.of(schemas);
    }

    private static String preprocessDDL(String ddlContent) {
        // JSqlParser does not know TIMESTAMPTZ / TIMESTAMP WITH TIME ZONE in every position
        return ddlContent
                .replaceAll("(?i)\\bTIMESTAMP\\s+WITH\\s+TIME\\s+ZONE\\b", "TIMESTAMPTZ")
                .replaceAll("(?i)\\bIF\\s+NOT\\s+EXISTS\\b", "");
    }

    private static EntitySchema convertTable(CreateTable createTable) {
        String tableName = cleanIdentifier(createTable.getTable().getName());
        if (createTable.getColumnDefinitions() == null || createTable.getColumnDefinitions().isEmpty()) {
            throw new IllegalArgumentException("Table '" + tableName + "' declares no columns");
        }

        List<String> fields = new ArrayList<>();
        List<String> primaryKey = new ArrayList<>();
        String timestampColumn = null;
        String valueColumn = null;

        for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
            String column = cleanIdentifier(colDef.getColumnName());
            String dataType = colDef.getColDataType().getDataType().toUpperCase(Locale.ROOT);
            fields.add(column);

            if (timestampColumn == null && dataType.startsWith("TIMESTAMP")) {
                timestampColumn = column;
            }
            if (column.equals("value") && NUMERIC_TYPES.contains(dataType.split("\\s+")[0])) {
                valueColumn = column;
            }
            if (isInlinePrimaryKey(colDef.getColumnSpecs())) {
                primaryKey.add(column);
            }
        }

        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                if ("PRIMARY KEY".equalsIgnoreCase(index.getType())) {
                    primaryKey.addAll(index.getColumnsNames().stream()
                            .map(SchemaParser::cleanIdentifier)
                            .collect(Collectors.toList()));
                }
            }
        }

        String tieBreak = chooseTieBreak(tableName, primaryKey, fields, timestampColumn);
        return EntitySchema.builder()
                .name(tableName)
                .table(tableName)
                .fields(fields)
                .timestampColumn(timestampColumn)
                .tieBreakColumn(tieBreak)
                .defaultSortField(timestampColumn != null ? timestampColumn : tieBreak)
                .valueColumn(valueColumn)
                .build();
    }

    private static boolean isInlinePrimaryKey(List<String> specs) {
        if (specs == null) {
            return false;
        }
        for (int i = 0; i < specs.size(); i++) {
            String spec = specs.get(i).toUpperCase(Locale.ROOT);
            if (spec.contains("PRIMARY KEY")
                    || spec.equals("PRIMARY") && i + 1 < specs.size() && specs.get(i + 1).equalsIgnoreCase("KEY")) {
                return true;
            }
        }
        return false;
    }

    /**
     * The tie-break must be unique: prefer a primary key column other than the timestamp,
     * then a column named {@code id}.
     */
    private static String chooseTieBreak(String table, List<String> primaryKey, List<String> fields,
                                         String timestampColumn) {
        for (String column : primaryKey) {
            if (!column.equals(timestampColumn)) {
                return column;
            }
        }
        if (fields.contains("id")) {
            return "id";
        }
        throw new IllegalArgumentException(
                "Table '" + table + "' has no primary key or id column to use as a pagination tie-break");
    }

    private static String cleanIdentifier(String identifier) {
        return identifier.replaceAll("[\\[\\]`\"]", "").toLowerCase(Locale.ROOT);
    }
}
