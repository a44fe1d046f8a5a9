package org.carball.srql.pagination;

import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.SortSpec;
import org.carball.srql.parser.FilterAccumulator;
import org.carball.srql.parser.QuerySerializer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fingerprint of the parts of a query a cursor depends on: entity, filters and sort. Filter
 * order and the order of values inside a set do not change the fingerprint.
 */
public final class QueryShape {

    private static final int FINGERPRINT_BYTES = 12;

    private QueryShape() {
        // Utility class - prevent instantiation
    }

    public static String canonical(String entity, List<FilterClause> filters, SortSpec sort) {
        String filterText = FilterAccumulator.accumulate(filters, true).stream()
                .map(QuerySerializer::serializeFilter)
                .sorted()
                .collect(Collectors.joining(" "));
        return "in:" + entity + "|" + filterText + "|" + sort.toSrql();
    }

    public static String fingerprint(String entity, List<FilterClause> filters, SortSpec sort) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical(entity, filters, sort).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(Arrays.copyOf(hash, FINGERPRINT_BYTES));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
