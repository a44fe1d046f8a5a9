package org.carball.srql.model.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.carball.srql.error.SrqlSyntaxException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A relative time span ending "now", such as {@code last_24h}. Any amount from 1 to
 * {@value #MAX_AMOUNT} minutes, hours, days or weeks is accepted, so the vocabulary is open rather
 * than a fixed list.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RelativeWindow {

    public static final long MAX_AMOUNT = 999_999;

    private static final Pattern SHORT_FORM = Pattern.compile("last_(\\d{1,6})([mhdw])", Pattern.CASE_INSENSITIVE);
    private static final Pattern LONG_FORM =
            Pattern.compile("(?:last\\s+)?(\\d{1,6})\\s*(minutes?|hours?|days?|weeks?)", Pattern.CASE_INSENSITIVE);

    long amount;
    Unit unit;

    public static RelativeWindow of(long amount, Unit unit) {
        if (amount <= 0 || amount > MAX_AMOUNT) {
            throw new IllegalArgumentException("window amount must be between 1 and " + MAX_AMOUNT + ": " + amount);
        }
        return new RelativeWindow(amount, unit);
    }

    public static RelativeWindow parse(String raw, int offset) throws SrqlSyntaxException {
        String text = raw.trim();
        Matcher shortForm = SHORT_FORM.matcher(text);
        if (shortForm.matches()) {
            return build(shortForm.group(1), Unit.fromSuffix(shortForm.group(2)), raw, offset);
        }
        Matcher longForm = LONG_FORM.matcher(text);
        if (longForm.matches()) {
            return build(longForm.group(1), Unit.fromWord(longForm.group(2)), raw, offset);
        }
        throw new SrqlSyntaxException("unsupported time window '" + raw + "'", offset);
    }

    private static RelativeWindow build(String digits, Unit unit, String raw, int offset) throws SrqlSyntaxException {
        long amount = Long.parseLong(digits);
        if (amount <= 0) {
            throw new SrqlSyntaxException("time window must be positive: '" + raw + "'", offset);
        }
        return new RelativeWindow(amount, unit);
    }

    /**
     * Canonical token value, e.g. {@code last_7d}.
     */
    public String getName() {
        return "last_" + amount + unit.suffix;
    }

    /**
     * Interval text for SQL, e.g. {@code 24 hours}. Built from the parsed number, never from raw input.
     */
    public String toSqlInterval() {
        return amount + " " + (amount == 1 ? unit.singular : unit.singular + "s");
    }

    public Duration toDuration() {
        return unit.base.multipliedBy(amount);
    }

    public Instant resolveStart(Instant now) {
        return now.minus(toDuration());
    }

    @Override
    public String toString() {
        return getName();
    }

    public enum Unit {
        MINUTES("m", "minute", Duration.ofMinutes(1)),
        HOURS("h", "hour", Duration.ofHours(1)),
        DAYS("d", "day", Duration.ofDays(1)),
        WEEKS("w", "week", Duration.ofDays(7));

        private final String suffix;
        private final String singular;
        private final Duration base;

        Unit(String suffix, String singular, Duration base) {
            this.suffix = suffix;
            this.singular = singular;
            this.base = base;
        }

        static Unit fromSuffix(String suffix) {
            String normalized = suffix.toLowerCase(Locale.ROOT);
            for (Unit unit : values()) {
                if (unit.suffix.equals(normalized)) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown window unit: " + suffix);
        }

        static Unit fromWord(String word) {
            String normalized = word.toLowerCase(Locale.ROOT);
            for (Unit unit : values()) {
                if (normalized.startsWith(unit.singular)) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown window unit: " + word);
        }
    }
}
