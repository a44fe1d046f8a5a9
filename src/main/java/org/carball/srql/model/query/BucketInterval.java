package org.carball.srql.model.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.carball.srql.error.SrqlSyntaxException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Width of a {@code time_bucket} used by {@code bucket:}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BucketInterval {

    private static final Pattern FORMAT = Pattern.compile("(\\d{1,6})([smhd])", Pattern.CASE_INSENSITIVE);

    long seconds;
    String text;

    public static BucketInterval parse(String raw, int offset) throws SrqlSyntaxException {
        Matcher matcher = FORMAT.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new SrqlSyntaxException("invalid bucket duration '" + raw + "', expected e.g. 30s, 5m, 1h, 1d", offset);
        }
        long amount = Long.parseLong(matcher.group(1));
        if (amount <= 0) {
            throw new SrqlSyntaxException("bucket duration must be positive: '" + raw + "'", offset);
        }
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        long multiplier = switch (unit) {
            case "s" -> 1L;
            case "m" -> 60L;
            case "h" -> 3_600L;
            default -> 86_400L;
        };
        return new BucketInterval(amount * multiplier, amount + unit);
    }

    public String toSqlInterval() {
        return seconds + (seconds == 1 ? " second" : " seconds");
    }

    @Override
    public String toString() {
        return text;
    }
}
