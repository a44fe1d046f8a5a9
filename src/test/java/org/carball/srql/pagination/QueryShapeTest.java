package org.carball.srql.pagination;

import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.SortDirection;
import org.carball.srql.model.query.SortSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryShapeTest {

    private static final SortSpec SORT = new SortSpec("timestamp", SortDirection.DESC);

    @Test
    void shouldIgnoreFilterAndValueOrder() {
        // Given
        List<FilterClause> first = List.of(
                FilterClause.in("severity_text", List.of("error", "fatal")),
                FilterClause.eq("service_name", "api"));
        List<FilterClause> second = List.of(
                FilterClause.eq("service_name", "api"),
                FilterClause.eq("severity_text", "fatal"),
                FilterClause.eq("severity_text", "error"));

        // Then
        assertThat(QueryShape.fingerprint("logs", first, SORT)).isEqualTo(QueryShape.fingerprint("logs", second, SORT));
    }

    @Test
    void shouldDistinguishEntityFiltersAndSort() {
        // Given
        List<FilterClause> filters = List.of(FilterClause.eq("service_name", "api"));
        String base = QueryShape.fingerprint("logs", filters, SORT);

        // Then
        assertThat(QueryShape.fingerprint("traces", filters, SORT)).isNotEqualTo(base);
        assertThat(QueryShape.fingerprint("logs", List.of(FilterClause.eq("service_name", "web")), SORT))
                .isNotEqualTo(base);
        assertThat(QueryShape.fingerprint("logs", filters, new SortSpec("timestamp", SortDirection.ASC)))
                .isNotEqualTo(base);
    }

    @Test
    void shouldBuildReadableCanonicalForm() {
        assertThat(QueryShape.canonical("logs", List.of(FilterClause.exists("trace_id")), SORT))
                .isEqualTo("in:logs|trace_id:*|timestamp:desc");
    }
}
