package org.carball.srql.parser;

import org.carball.srql.error.SrqlSyntaxException;
import org.carball.srql.model.query.Clause;
import org.carball.srql.model.query.ClauseKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenClassifierTest {

    @Test
    void shouldClassifyReservedKeywords() throws Exception {
        // Given
        List<Token> tokens = Tokenizer.tokenize(
                "in:logs time:last_1h sort:timestamp:asc limit:5 cursor:abc stats:\"count() as n\" "
                        + "bucket:5m series:service_name agg:avg stream:true");

        // When
        List<Clause> clauses = TokenClassifier.classify(tokens);

        // Then
        assertThat(clauses).extracting(Clause::kind).containsExactly(
                ClauseKind.ENTITY, ClauseKind.TIME, ClauseKind.SORT, ClauseKind.LIMIT, ClauseKind.CURSOR,
                ClauseKind.STATS, ClauseKind.BUCKET, ClauseKind.SERIES, ClauseKind.AGG, ClauseKind.STREAM);
    }

    @Test
    void shouldTreatKeyAliasesAsTheirClause() throws Exception {
        assertThat(TokenClassifier.classify(new Token("order:timestamp:desc", 0)).kind()).isEqualTo(ClauseKind.SORT);
        assertThat(TokenClassifier.classify(new Token("timeframe:\"7 Days\"", 0)).kind()).isEqualTo(ClauseKind.TIME);
    }

    @Test
    void shouldTreatUnknownKeysAsFieldFilters() throws Exception {
        // When
        Clause clause = TokenClassifier.classify(new Token("!Severity_Text:error", 4));

        // Then
        assertThat(clause.kind()).isEqualTo(ClauseKind.FIELD_FILTER);
        assertThat(clause.key()).isEqualTo("severity_text");
        assertThat(clause.negated()).isTrue();
        assertThat(clause.rawValue()).isEqualTo("error");
        assertThat(clause.valueOffset()).isEqualTo(19);
    }

    @Test
    void shouldRejectTokenWithoutColon() {
        assertThatThrownBy(() -> TokenClassifier.classify(new Token("logs", 0)))
                .isInstanceOf(SrqlSyntaxException.class)
                .hasMessageContaining("expected <key>:<value>");
    }

    @Test
    void shouldRejectEmptyValue() {
        assertThatThrownBy(() -> TokenClassifier.classify(new Token("time:", 8)))
                .isInstanceOf(SrqlSyntaxException.class)
                .hasMessageContaining("missing value for 'time'")
                .extracting("offset").isEqualTo(13);
    }

    @Test
    void shouldRejectNegatedKeyword() {
        assertThatThrownBy(() -> TokenClassifier.classify(new Token("!limit:5", 0)))
                .isInstanceOf(SrqlSyntaxException.class)
                .hasMessageContaining("cannot be negated");
    }
}
