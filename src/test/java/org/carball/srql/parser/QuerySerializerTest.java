package org.carball.srql.parser;

import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;
import org.carball.srql.model.query.Query;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuerySerializerTest {

    @Test
    void shouldWriteCanonicalClauseOrder() throws Exception {
        // Given
        Query query = new QueryParser().parse(
                "limit:20 sort:timestamp service_name:api in:logs time:last_2h stream:true");

        // When
        String text = QuerySerializer.serialize(query);

        // Then
        assertThat(text).isEqualTo("in:logs time:last_2h service_name:api sort:timestamp:desc limit:20 stream:true");
    }

    @Test
    void shouldQuoteValuesThatLookLikeSyntax() {
        assertThat(QuerySerializer.serializeFilter(FilterClause.eq("body", "disk full"))).isEqualTo("body:\"disk full\"");
        assertThat(QuerySerializer.serializeFilter(FilterClause.eq("body", "50%"))).isEqualTo("body:\"50%\"");
        assertThat(filter(FilterOperator.NOT_IN, "a,b", "c"))
                .isEqualTo("!body:(\"a,b\",c)");
        assertThat(filter(FilterOperator.WILDCARD_PREFIX_SUFFIX, "x y"))
                .isEqualTo("body:%\"x y\"%");
        assertThat(QuerySerializer.serializeFilter(new FilterClause("body", FilterOperator.NOT_EXISTS, List.of())))
                .isEqualTo("!body:*");
    }

    @Test
    void shouldParseBackWhatItWrites() throws Exception {
        // Given
        Query original = new QueryParser().parse(
                "in:logs body:%\"x y\"% !service_name:(\"a,b\",c) trace_id:* "
                        + "stats:\"count() as total, sum(if(severity_text = 'it''s', 1, 0)) as odd\"");

        // When
        Query reparsed = new QueryParser().parse(QuerySerializer.serialize(original));

        // Then
        assertThat(reparsed).isEqualTo(original);
    }

    private static String filter(FilterOperator operator, String... values) {
        return QuerySerializer.serializeFilter(new FilterClause("body", operator, List.of(values)));
    }
}
