package org.carball.srql.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.srql.error.InvalidCursorException;
import org.carball.srql.model.query.PageDirection;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Encodes cursors as {@code base64url(json) "." base64url(hmac)}. The JSON payload carries the
 * boundary values with a type tag each, so decoding returns exactly the values that were
 * encoded. The HMAC makes edited cursors fail instead of paging from an arbitrary position.
 */
@Slf4j
public class CursorCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int SIGNATURE_BYTES = 16;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecretKeySpec key;

    public CursorCodec(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Cursor secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public String encode(CursorToken token) {
        ObjectNode payload = objectMapper.createObjectNode();
        putValue(payload, "v", "vt", token.getSortValue());
        putValue(payload, "id", "it", token.getTieBreakValue());
        payload.put("d", token.getDirection().keyword());
        payload.put("f", token.getFingerprint());

        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize cursor", e);
        }
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString(json) + "." + encoder.encodeToString(sign(json));
    }

    public CursorToken decode(String cursor) throws InvalidCursorException {
        if (cursor == null || cursor.isBlank()) {
            throw new InvalidCursorException("cursor is empty");
        }
        int dot = cursor.indexOf('.');
        if (dot <= 0 || dot == cursor.length() - 1 || cursor.indexOf('.', dot + 1) >= 0) {
            throw new InvalidCursorException("cursor is malformed");
        }

        byte[] json;
        byte[] signature;
        try {
            Base64.Decoder decoder = Base64.getUrlDecoder();
            json = decoder.decode(cursor.substring(0, dot));
            signature = decoder.decode(cursor.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("cursor is not valid base64", e);
        }

        if (!MessageDigest.isEqual(sign(json), signature)) {
            log.debug("Rejected cursor with bad signature");
            throw new InvalidCursorException("cursor signature does not match");
        }

        try {
            JsonNode payload = objectMapper.readTree(json);
            PageDirection direction = PageDirection.parse(payload.path("d").asText(null))
                    .orElseThrow(() -> new InvalidCursorException("cursor has no direction"));
            String fingerprint = payload.path("f").asText(null);
            if (fingerprint == null) {
                throw new InvalidCursorException("cursor has no query fingerprint");
            }
            return new CursorToken(readValue(payload, "v", "vt"), readValue(payload, "id", "it"),
                    direction, fingerprint);
        } catch (IOException e) {
            throw new InvalidCursorException("cursor payload is not valid JSON", e);
        }
    }

    private static void putValue(ObjectNode payload, String field, String typeField, Object value) {
        if (value instanceof Long number) {
            payload.put(field, number);
            payload.put(typeField, "l");
        } else if (value instanceof Double number) {
            payload.put(field, number);
            payload.put(typeField, "d");
        } else if (value instanceof BigDecimal decimal) {
            payload.put(field, decimal.toPlainString());
            payload.put(typeField, "n");
        } else if (value instanceof Boolean flag) {
            payload.put(field, flag);
            payload.put(typeField, "b");
        } else if (value instanceof Instant instant) {
            payload.put(field, instant.toString());
            payload.put(typeField, "i");
        } else {
            payload.put(field, String.valueOf(value));
            payload.put(typeField, "s");
        }
    }

    private static Object readValue(JsonNode payload, String field, String typeField) throws InvalidCursorException {
        JsonNode value = payload.get(field);
        if (value == null || value.isNull()) {
            throw new InvalidCursorException("cursor is missing '" + field + "'");
        }
        String type = payload.path(typeField).asText("s");
        return switch (type) {
            case "l" -> {
                if (!value.canConvertToLong()) {
                    throw new InvalidCursorException("cursor value '" + field + "' is not an integer");
                }
                yield value.asLong();
            }
            case "d" -> value.asDouble();
            case "n" -> {
                try {
                    yield new BigDecimal(value.asText());
                } catch (NumberFormatException e) {
                    throw new InvalidCursorException("cursor value '" + field + "' is not a decimal", e);
                }
            }
            case "b" -> value.asBoolean();
            case "i" -> {
                try {
                    yield Instant.parse(value.asText());
                } catch (DateTimeParseException e) {
                    throw new InvalidCursorException("cursor value '" + field + "' is not a timestamp", e);
                }
            }
            case "s" -> value.asText();
            default -> throw new InvalidCursorException("cursor value '" + field + "' has unknown type '" + type + "'");
        };
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return Arrays.copyOf(mac.doFinal(payload), SIGNATURE_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
