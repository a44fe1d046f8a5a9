package org.carball.srql.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.srql.builder.QueryBuilder;
import org.carball.srql.builder.RawModeRequiredException;
import org.carball.srql.compiler.CompiledQuery;
import org.carball.srql.compiler.QueryPlan;
import org.carball.srql.compiler.QueryTranslator;
import org.carball.srql.config.CatalogLoader;
import org.carball.srql.config.ConfigurationLoader;
import org.carball.srql.config.SrqlConfig;
import org.carball.srql.error.SrqlError;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.SrqlResult;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.schema.SchemaCatalog;
import org.carball.srql.parser.QueryParser;
import org.carball.srql.parser.QuerySerializer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class SrqlCLI {

    private static final String VERSION = "1.0.0";

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;

    public SrqlCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        int status = new SrqlCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(status);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            return args.length < 2 && !isHelpRequested(args) ? 1 : 0;
        }

        String command = args[0];
        String query = args[1];
        try {
            SrqlConfig config = configurationLoader.loadConfiguration(args);
            SchemaCatalog catalog = loadCatalog(config);
            OutputFormat format = OutputFormat.fromString(getOption(args, "--format", "text"));

            return switch (command) {
                case "translate" -> translate(query, args, catalog, config, format);
                case "parse" -> parse(query, config, format);
                case "builder" -> builder(query, catalog, config);
                default -> {
                    err.println("Unknown command: " + command);
                    printUsage();
                    yield 1;
                }
            };
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private int translate(String query, String[] args, SchemaCatalog catalog, SrqlConfig config,
                          OutputFormat format) throws IOException {
        Integer limit = null;
        String rawLimit = getOption(args, "--limit", null);
        if (rawLimit != null) {
            try {
                limit = Integer.parseInt(rawLimit);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid --limit: " + rawLimit);
            }
        }

        QueryTranslator translator = new QueryTranslator(catalog, config);
        SrqlResult<CompiledQuery> result = translator.translate(
                query, getOption(args, "--cursor", null), getOption(args, "--direction", null), limit);
        if (!result.isOk()) {
            return fail(result.getError());
        }

        CompiledQuery compiled = result.getValue();
        if (format == OutputFormat.TEXT) {
            QueryPlan plan = compiled.getPlan();
            out.println("SQL:    " + compiled.getSql());
            out.println("Params: " + compiled.getParams());
            out.printf("Plan:   entity=%s, limit=%d, direction=%s, paginated=%s, stream=%s%n",
                    plan.getSchema().getName(), plan.getLimit(), plan.getDirection().keyword(),
                    plan.isPaginated(), plan.isStream());
        } else {
            out.println(render(toDocument(compiled), format));
        }
        return 0;
    }

    private int parse(String text, SrqlConfig config, OutputFormat format) throws IOException {
        try {
            Query query = new QueryParser(config.getMaxStatsExpressions()).parse(text);
            String canonical = QuerySerializer.serialize(query);
            if (format == OutputFormat.TEXT) {
                out.println(canonical);
            } else {
                Map<String, Object> document = new LinkedHashMap<>();
                document.put("entity", query.getEntity());
                document.put("filters", query.getFilters().stream()
                        .map(QuerySerializer::serializeFilter)
                        .collect(Collectors.toList()));
                document.put("canonical", canonical);
                out.println(render(document, format));
            }
            return 0;
        } catch (SrqlException e) {
            return fail(SrqlError.of(e));
        }
    }

    private int builder(String text, SchemaCatalog catalog, SrqlConfig config) {
        QueryBuilder builder = new QueryBuilder(catalog, config);
        try {
            out.println(builder.serialize(builder.parse(text)));
            return 0;
        } catch (RawModeRequiredException e) {
            out.println("raw mode: " + e.getMessage());
            return 0;
        } catch (SrqlException e) {
            return fail(SrqlError.of(e));
        }
    }

    private int fail(SrqlError error) {
        err.println(error.displayMessage());
        return 1;
    }

    private SchemaCatalog loadCatalog(SrqlConfig config) throws IOException {
        CatalogLoader loader = new CatalogLoader();
        if (config.getCatalogFile() != null) {
            return loader.load(Path.of(config.getCatalogFile()));
        }
        return loader.loadBundled();
    }

    private static Map<String, Object> toDocument(CompiledQuery compiled) {
        QueryPlan plan = compiled.getPlan();
        Map<String, Object> planDocument = new LinkedHashMap<>();
        planDocument.put("entity", plan.getSchema().getName());
        planDocument.put("limit", plan.getLimit());
        planDocument.put("direction", plan.getDirection().keyword());
        planDocument.put("paginated", plan.isPaginated());
        planDocument.put("stream", plan.isStream());
        planDocument.put("fingerprint", plan.getFingerprint());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("sql", compiled.getSql());
        document.put("params", compiled.getParams().stream()
                .map(param -> param instanceof Instant ? param.toString() : param)
                .collect(Collectors.toList()));
        document.put("plan", planDocument);
        return document;
    }

    private static String render(Object document, OutputFormat format) throws IOException {
        ObjectMapper mapper = format == OutputFormat.YAML ? new ObjectMapper(new YAMLFactory()) : new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper.writeValueAsString(document).stripTrailing();
    }

    private static String getOption(String[] args, String name, String defaultValue) {
        for (int i = 2; i < args.length - 1; i++) {
            if (args[i].equals(name)) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }

    private static boolean isHelpRequested(String[] args) {
        List<String> list = Arrays.asList(args);
        return list.contains("--help") || list.contains("-h") || list.contains("help");
    }

    private void printUsage() {
        out.println("SRQL query compiler v" + VERSION);
        out.println();
        out.println("Usage: java -jar srql-core.jar <command> <query> [options]");
        out.println();
        out.println("Commands:");
        out.println("  translate           Compile a query to parameterized SQL");
        out.println("  parse               Print the normalized form of a query");
        out.println("  builder             Print the structured editor's form of a query");
        out.println();
        out.println("Options:");
        out.println("  --cursor            Pagination cursor from a previous page");
        out.println("  --direction         next|prev (default: the cursor's direction)");
        out.println("  --limit             Rows per page, overrides limit: in the query");
        out.println("  --format            text|json|yaml (default: text)");
        out.println("  --catalog           Entity catalog file, YAML or SQL DDL (default: bundled)");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  java -jar srql-core.jar translate 'in:logs severity_text:(fatal,error) time:last_24h'");
        out.println("  java -jar srql-core.jar translate 'in:logs' --limit 50 --format json");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }
}
