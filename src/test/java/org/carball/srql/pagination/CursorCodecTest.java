package org.carball.srql.pagination;

import org.carball.srql.error.InvalidCursorException;
import org.carball.srql.model.query.PageDirection;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CursorCodecTest {

    private final CursorCodec codec = new CursorCodec("test-secret");

    @Test
    void shouldPreserveValueTypesThroughEncoding() throws InvalidCursorException {
        assertRoundTrip(CursorToken.of(Instant.parse("2024-05-01T12:00:00.123456Z"), 42L, PageDirection.NEXT, "fp"));
        assertRoundTrip(CursorToken.of(0.25, "a b/c", PageDirection.PREV, "fp"));
        assertRoundTrip(CursorToken.of(true, Long.MAX_VALUE, PageDirection.NEXT, "fp"));
    }

    @Test
    void shouldNormalizeRowValues() {
        // When
        CursorToken token = CursorToken.of(
                Timestamp.from(Instant.parse("2024-05-01T00:00:00Z")), 7, PageDirection.NEXT, "fp");

        // Then
        assertThat(token.getSortValue()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        assertThat(token.getTieBreakValue()).isEqualTo(7L);
        assertThat(CursorToken.normalize(new BigDecimal("1.5"))).isEqualTo(new BigDecimal("1.5"));
        assertThat(CursorToken.normalize(1.5f)).isEqualTo(1.5);
        assertThat(CursorToken.normalize(OffsetDateTime.of(2024, 5, 1, 2, 0, 0, 0, ZoneOffset.ofHours(2))))
                .isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        assertThatThrownBy(() -> CursorToken.of(null, 1, PageDirection.NEXT, "fp"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepDecimalSortValuesExact() throws InvalidCursorException {
        // Given
        BigDecimal amount = new BigDecimal("12345678901234567890.123456789");

        // When
        CursorToken decoded = assertRoundTrip(CursorToken.of(amount, 3, PageDirection.NEXT, "fp"));

        // Then
        assertThat(decoded.getSortValue()).isInstanceOf(BigDecimal.class).isEqualTo(amount);
    }

    @Test
    void shouldProduceUrlSafeCursor() {
        // When
        String cursor = codec.encode(CursorToken.of("??>>~~", 1L, PageDirection.NEXT, "fp"));

        // Then
        assertThat(cursor).matches("[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");
    }

    @Test
    void shouldRejectCursorSignedWithAnotherSecret() {
        // Given
        String cursor = new CursorCodec("other-secret").encode(CursorToken.of(1L, 1L, PageDirection.NEXT, "fp"));

        // Then
        assertThatThrownBy(() -> codec.decode(cursor))
                .isInstanceOf(InvalidCursorException.class)
                .hasMessageContaining("signature");
    }

    @Test
    void shouldRejectEditedPayload() {
        // Given
        String cursor = codec.encode(CursorToken.of(1L, 1L, PageDirection.NEXT, "fp"));
        String forged = Base64.getUrlEncoder().withoutPadding().encodeToString(
                "{\"v\":999,\"vt\":\"l\",\"id\":1,\"it\":\"l\",\"d\":\"next\",\"f\":\"fp\"}".getBytes())
                + cursor.substring(cursor.indexOf('.'));

        // Then
        assertThatThrownBy(() -> codec.decode(forged)).isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void shouldRejectMalformedCursors() {
        assertThatThrownBy(() -> codec.decode("")).isInstanceOf(InvalidCursorException.class);
        assertThatThrownBy(() -> codec.decode("nodot")).isInstanceOf(InvalidCursorException.class);
        assertThatThrownBy(() -> codec.decode("a.b.c")).isInstanceOf(InvalidCursorException.class);
        assertThatThrownBy(() -> codec.decode("!!!.???")).isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void shouldRequireSecret() {
        assertThatThrownBy(() -> new CursorCodec("")).isInstanceOf(IllegalArgumentException.class);
    }

    private CursorToken assertRoundTrip(CursorToken token) throws InvalidCursorException {
        CursorToken decoded = codec.decode(codec.encode(token));
        assertThat(decoded).isEqualTo(token);
        return decoded;
    }
}
