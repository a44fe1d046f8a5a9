package org.carball.srql.compiler;

import org.carball.srql.TestSchemas;
import org.carball.srql.config.PlaceholderStyle;
import org.carball.srql.config.SrqlConfig;
import org.carball.srql.error.InvalidCursorException;
import org.carball.srql.error.LimitOutOfRangeException;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.UnknownEntityException;
import org.carball.srql.error.UnknownFieldException;
import org.carball.srql.error.UnsupportedExpressionException;
import org.carball.srql.model.query.FilterOperator;
import org.carball.srql.model.query.PageDirection;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.query.SortDirection;
import org.carball.srql.model.query.SortSpec;
import org.carball.srql.pagination.CursorToken;
import org.carball.srql.pagination.QueryShape;
import org.carball.srql.parser.QueryParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryCompilerTest {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");
    private static final String LOG_COLUMNS = "id, timestamp, severity_text, service_name, body, trace_id";

    private final QueryParser parser = new QueryParser();

    @Test
    void shouldCompileFilteredLogQuery() throws SrqlException {
        // When
        CompiledQuery compiled = compile(
                "in:logs severity_text:(fatal,error,FATAL,ERROR) time:last_24h sort:timestamp:desc limit:20");

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT " + LOG_COLUMNS + " FROM logs"
                + " WHERE severity_text IN ($1, $2, $3, $4)"
                + " AND timestamp >= now() - interval '24 hours'"
                + " ORDER BY timestamp DESC, id DESC LIMIT 21");
        assertThat(compiled.getParams()).containsExactly("fatal", "error", "FATAL", "ERROR");
        assertThat(compiled.getPlan().getLimit()).isEqualTo(20);
        assertThat(compiled.getPlan().getFetchLimit()).isEqualTo(21);
        assertThat(compiled.getPlan().isPaginated()).isTrue();
        assertThat(compiled.getPlan().hasProbeRow()).isTrue();
    }

    @Test
    void shouldCompileConditionalCountStats() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:logs time:last_24h stats:\"count() as total, "
                + "sum(if(severity_text = 'fatal' OR severity_text = 'FATAL', 1, 0)) as fatal\"");

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT COUNT(*) AS total, "
                + "COALESCE(SUM(CASE WHEN (severity_text = $1 OR severity_text = $2) THEN 1 ELSE 0 END), 0) AS fatal"
                + " FROM logs WHERE timestamp >= now() - interval '24 hours' LIMIT 100");
        assertThat(compiled.getParams()).containsExactly("fatal", "FATAL");
        assertThat(compiled.getSql()).containsOnlyOnce("CASE WHEN");
        assertThat(compiled.getPlan().isPaginated()).isFalse();
    }

    @Test
    void shouldParenthesizeAndGroupsInsideOr() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:logs stats:\"sum(if(severity_text = 'error' AND service_name != 'api' "
                + "OR body = 'boom', 1, 0)) as hits, max(id) as last_id\"");

        // Then
        assertThat(compiled.getSql()).startsWith("SELECT COALESCE(SUM(CASE WHEN "
                + "((severity_text = $1 AND service_name <> $2) OR body = $3) THEN 1 ELSE 0 END), 0) AS hits, "
                + "MAX(id) AS last_id FROM logs");
        assertThat(compiled.getParams()).containsExactly("error", "api", "boom");
    }

    @Test
    void shouldNumberPlaceholdersInTextualOrder() throws SrqlException {
        // When
        CompiledQuery compiled = compile(
                "in:logs service_name:a,b !severity_text:debug body:%timeout% trace_id:* time:last_1h");

        // Then
        assertThat(compiled.getSql()).contains("service_name IN ($1, $2)")
                .contains("severity_text <> $3")
                .contains("body LIKE $4")
                .contains("trace_id IS NOT NULL");
        assertThat(compiled.getParams()).containsExactly("a", "b", "debug", "%timeout%");
        assertPlaceholdersMatchParams(compiled);
    }

    @Test
    void shouldOrPositiveAndAndNegativeClausesOnSameField() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:logs service_name:api service_name:web% !service_name:test");

        // Then
        assertThat(compiled.getSql()).contains(
                "WHERE (service_name = $1 OR service_name LIKE $2) AND service_name <> $3 ORDER BY");
        assertThat(compiled.getParams()).containsExactly("api", "web%", "test");
    }

    @Test
    void shouldRenderNegatedMembershipAndExistence() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:logs !severity_text:(debug,trace) !trace_id:*");

        // Then
        assertThat(compiled.getSql()).contains("WHERE severity_text NOT IN ($1, $2) AND trace_id IS NULL");
    }

    @Test
    void shouldEscapeLikeMetacharacters() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:logs body:%50_off% !service_name:\"100%\"%");

        // Then
        assertThat(compiled.getSql()).contains("body LIKE $1").contains("service_name NOT LIKE $2");
        assertThat(compiled.getParams()).containsExactly("%50\\_off%", "100\\%%");
    }

    @Test
    void shouldBuildLikePatterns() {
        assertThat(QueryCompiler.likePattern(FilterOperator.WILDCARD_SUFFIX, "a\\b")).isEqualTo("a\\\\b%");
        assertThat(QueryCompiler.likePattern(FilterOperator.NOT_WILDCARD_PREFIX, "end")).isEqualTo("%end");
        assertThatThrownBy(() -> QueryCompiler.likePattern(FilterOperator.EQ, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldUseIlikeWhenConfigured() throws SrqlException {
        // Given
        SrqlConfig config = SrqlConfig.builder().caseInsensitiveWildcards(true).build();

        // When
        CompiledQuery compiled = compile(config, "in:logs body:%error%");

        // Then
        assertThat(compiled.getSql()).contains("body ILIKE $1");
    }

    @Test
    void shouldRenderJdbcPlaceholdersWhenConfigured() throws SrqlException {
        // Given
        SrqlConfig config = SrqlConfig.builder().placeholderStyle(PlaceholderStyle.JDBC).build();

        // When
        CompiledQuery compiled = compile(config, "in:logs severity_text:error,warn");

        // Then
        assertThat(compiled.getSql()).contains("severity_text IN (?, ?)").doesNotContain("$");
    }

    @Test
    void shouldKeepLiteralsOutOfSql() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:logs body:\"x'; DROP TABLE logs; --\"");

        // Then
        assertThat(compiled.getSql()).doesNotContain("DROP").doesNotContain("'x");
        assertThat(compiled.getParams()).containsExactly("x'; DROP TABLE logs; --");
    }

    @Test
    void shouldDefaultSortAndOmitRedundantTieBreak() throws SrqlException {
        assertThat(compile("in:items").getSql())
                .isEqualTo("SELECT id, score, category FROM items ORDER BY score DESC, id DESC LIMIT 101");
        assertThat(compile("in:items sort:id:asc").getSql())
                .isEqualTo("SELECT id, score, category FROM items ORDER BY id ASC LIMIT 101");
    }

    @Test
    void shouldApplyKeysetPredicateForNextPage() throws SrqlException {
        // Given
        Query query = parser.parse("in:items category:a limit:10");
        CursorToken cursor = CursorToken.of(50, 7, PageDirection.NEXT, itemsFingerprint(query));

        // When
        CompiledQuery compiled = compiler(SrqlConfig.defaults()).compile(query, cursor);

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT id, score, category FROM items"
                + " WHERE category = $1 AND (score, id) < ($2, $3) ORDER BY score DESC, id DESC LIMIT 11");
        assertThat(compiled.getParams()).containsExactly("a", 50L, 7L);
        assertThat(compiled.getPlan().getCursor()).isEqualTo(cursor);
    }

    @Test
    void shouldReverseScanForPreviousPage() throws SrqlException {
        // Given
        Query query = parser.parse("in:items limit:10").toBuilder().direction(PageDirection.PREV).build();
        CursorToken cursor = CursorToken.of(50, 7, PageDirection.PREV, itemsFingerprint(query));

        // When
        CompiledQuery compiled = compiler(SrqlConfig.defaults()).compile(query, cursor);

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT id, score, category FROM items"
                + " WHERE (score, id) > ($1, $2) ORDER BY score ASC, id ASC LIMIT 11");
        assertThat(compiled.getPlan().getDirection()).isEqualTo(PageDirection.PREV);
    }

    @Test
    void shouldMirrorKeysetComparisonForAscendingSort() throws SrqlException {
        // Given
        Query next = parser.parse("in:items sort:score:asc limit:10");
        Query prev = next.toBuilder().direction(PageDirection.PREV).build();
        String fingerprint = QueryShape.fingerprint("items", List.of(), new SortSpec("score", SortDirection.ASC));

        // When
        CompiledQuery forward = compiler(SrqlConfig.defaults())
                .compile(next, CursorToken.of(20, 7, PageDirection.NEXT, fingerprint));
        CompiledQuery backward = compiler(SrqlConfig.defaults())
                .compile(prev, CursorToken.of(20, 7, PageDirection.PREV, fingerprint));

        // Then
        assertThat(forward.getSql()).isEqualTo("SELECT id, score, category FROM items"
                + " WHERE (score, id) > ($1, $2) ORDER BY score ASC, id ASC LIMIT 11");
        assertThat(backward.getSql()).isEqualTo("SELECT id, score, category FROM items"
                + " WHERE (score, id) < ($1, $2) ORDER BY score DESC, id DESC LIMIT 11");
        assertThat(backward.getParams()).containsExactly(20L, 7L);
    }

    @Test
    void shouldUseSingleColumnKeysetWhenSortingByTieBreak() throws SrqlException {
        // Given
        Query query = parser.parse("in:items sort:id:asc");
        String fingerprint = QueryShape.fingerprint("items", List.of(), new SortSpec("id", SortDirection.ASC));

        // When
        CompiledQuery compiled = compiler(SrqlConfig.defaults())
                .compile(query, CursorToken.of(7, 7, PageDirection.NEXT, fingerprint));

        // Then
        assertThat(compiled.getSql()).contains("WHERE id > $1 ORDER BY id ASC");
        assertThat(compiled.getParams()).containsExactly(7L);
    }

    @Test
    void shouldRejectCursorFromDifferentQueryShape() throws SrqlException {
        // Given
        Query query = parser.parse("in:items category:a");
        CursorToken cursor = CursorToken.of(50, 7, PageDirection.NEXT, itemsFingerprint(parser.parse("in:items")));

        // Then
        assertThatThrownBy(() -> compiler(SrqlConfig.defaults()).compile(query, cursor))
                .isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void shouldCompileBucketedSeriesAggregation() throws SrqlException {
        // When
        CompiledQuery compiled = compile("in:cpu_metrics time:last_1h bucket:5m series:device_id agg:avg");

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT device_id, "
                + "time_bucket(interval '300 seconds', timestamp) AS bucket, AVG(usage_percent) AS value"
                + " FROM cpu_metrics WHERE timestamp >= now() - interval '1 hour'"
                + " GROUP BY device_id, bucket ORDER BY bucket ASC, device_id ASC LIMIT 100");
        assertThat(compiled.getParams()).isEmpty();
        assertThat(compiled.getPlan().isPaginated()).isFalse();
        assertThat(compiled.getPlan().hasProbeRow()).isFalse();
    }

    @Test
    void shouldCountRowsForCountAggregation() throws SrqlException {
        assertThat(compile("in:cpu_metrics agg:count").getSql())
                .isEqualTo("SELECT COUNT(*) AS value FROM cpu_metrics LIMIT 100");
    }

    @Test
    void shouldPrependBucketToRowProjection() throws SrqlException {
        assertThat(compile("in:logs bucket:1m limit:5").getSql())
                .isEqualTo("SELECT time_bucket(interval '60 seconds', timestamp) AS bucket, " + LOG_COLUMNS
                        + " FROM logs ORDER BY timestamp DESC, id DESC LIMIT 6");
    }

    @Test
    void shouldRejectUnknownEntityAndFields() {
        assertThatThrownBy(() -> compile("in:widgets")).isInstanceOf(UnknownEntityException.class);
        assertThatThrownBy(() -> compile("in:logs hostname:web01"))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("'hostname'");
        assertThatThrownBy(() -> compile("in:logs sort:score")).isInstanceOf(UnknownFieldException.class);
        assertThatThrownBy(() -> compile("in:cpu_metrics series:core agg:max")).isInstanceOf(UnknownFieldException.class);
        assertThatThrownBy(() -> compile("in:logs stats:\"sum(if(level = 'x', 1, 0)) as n\""))
                .isInstanceOf(UnknownFieldException.class);
        assertThatThrownBy(() -> compile("in:logs stats:\"avg(duration_ms) as n\""))
                .isInstanceOf(UnknownFieldException.class);
    }

    @Test
    void shouldRejectUnsupportedCombinations() {
        assertThatThrownBy(() -> compile("in:items time:last_1h")).isInstanceOf(UnsupportedExpressionException.class);
        assertThatThrownBy(() -> compile("in:items bucket:5m")).isInstanceOf(UnsupportedExpressionException.class);
        assertThatThrownBy(() -> compile("in:logs agg:max")).isInstanceOf(UnsupportedExpressionException.class);
        assertThatThrownBy(() -> compile("in:cpu_metrics agg:max stats:\"count() as n\""))
                .isInstanceOf(UnsupportedExpressionException.class);
    }

    @Test
    void shouldClampLimitsByDefault() throws SrqlException {
        // Given
        SrqlConfig config = SrqlConfig.builder().maxLimit(500).build();

        // Then
        assertThat(compile(config, "in:logs limit:10000").getPlan().getLimit()).isEqualTo(500);
        assertThat(compile(config, "in:logs limit:0").getSql()).endsWith("LIMIT 2");
        assertThat(compile(config, "in:logs").getPlan().getLimit()).isEqualTo(100);
    }

    @Test
    void shouldRejectOutOfRangeLimitsWhenStrict() {
        // Given
        SrqlConfig config = SrqlConfig.builder().strictLimits(true).maxLimit(500).build();

        // Then
        assertThatThrownBy(() -> compile(config, "in:logs limit:501")).isInstanceOf(LimitOutOfRangeException.class);
        assertThatThrownBy(() -> compile(config, "in:logs limit:0")).isInstanceOf(LimitOutOfRangeException.class);
    }

    private CompiledQuery compile(String text) throws SrqlException {
        return compile(SrqlConfig.defaults(), text);
    }

    private CompiledQuery compile(SrqlConfig config, String text) throws SrqlException {
        return compiler(config).compile(parser.parse(text), null);
    }

    private static QueryCompiler compiler(SrqlConfig config) {
        return new QueryCompiler(TestSchemas.catalog(), config);
    }

    private static String itemsFingerprint(Query query) {
        return QueryShape.fingerprint("items", query.getFilters(), TestSchemas.ITEMS.getDefaultSort());
    }

    private static void assertPlaceholdersMatchParams(CompiledQuery compiled) {
        Matcher matcher = PLACEHOLDER.matcher(compiled.getSql());
        int expected = 1;
        while (matcher.find()) {
            assertThat(Integer.parseInt(matcher.group(1))).isEqualTo(expected++);
        }
        assertThat(expected - 1).isEqualTo(compiled.getParams().size());
    }
}
