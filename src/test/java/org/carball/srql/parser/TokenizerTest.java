package org.carball.srql.parser;

import org.carball.srql.error.SrqlSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenizerTest {

    @Test
    void shouldSplitOnWhitespace() throws Exception {
        // When
        List<Token> tokens = Tokenizer.tokenize("in:logs   time:last_2h\tlimit:5");

        // Then
        assertThat(tokens).extracting(Token::text).containsExactly("in:logs", "time:last_2h", "limit:5");
        assertThat(tokens).extracting(Token::offset).containsExactly(0, 10, 23);
    }

    @Test
    void shouldKeepQuotedSpansInOneToken() throws Exception {
        // When
        List<Token> tokens = Tokenizer.tokenize("in:logs body:\"disk \\\"sda\\\" full\" service_name:api");

        // Then
        assertThat(tokens).extracting(Token::text)
                .containsExactly("in:logs", "body:\"disk \\\"sda\\\" full\"", "service_name:api");
    }

    @Test
    void shouldKeepParenthesisedListsInOneToken() throws Exception {
        // When
        List<Token> tokens = Tokenizer.tokenize("severity_text:(fatal, error) in:logs");

        // Then
        assertThat(tokens).extracting(Token::text).containsExactly("severity_text:(fatal, error)", "in:logs");
    }

    @Test
    void shouldReturnNoTokensForBlankInput() throws Exception {
        assertThat(Tokenizer.tokenize("   ")).isEmpty();
        assertThat(Tokenizer.tokenize(null)).isEmpty();
    }

    @Test
    void shouldReportUnterminatedQuoteAtItsOffset() {
        // When/Then
        assertThatThrownBy(() -> Tokenizer.tokenize("in:logs body:\"never closed"))
                .isInstanceOf(SrqlSyntaxException.class)
                .hasMessageContaining("unterminated quote")
                .extracting("offset").isEqualTo(13);
    }

    @Test
    void shouldRejectUnbalancedParentheses() {
        assertThatThrownBy(() -> Tokenizer.tokenize("in:logs a:(x,y"))
                .isInstanceOf(SrqlSyntaxException.class)
                .hasMessageContaining("unterminated '('");

        assertThatThrownBy(() -> Tokenizer.tokenize("in:logs a:x)"))
                .isInstanceOf(SrqlSyntaxException.class)
                .hasMessageContaining("unbalanced ')'");
    }
}
