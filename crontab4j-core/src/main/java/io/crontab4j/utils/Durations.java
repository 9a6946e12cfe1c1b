package io.crontab4j.utils;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Parses human interval text into a {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Bare seconds: "90"</li>
 *   <li>Compact: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Unit pairs: "5 minutes", "1 day 3 hours" (each unit at most once)</li>
 * </ul>
 */
public final class Durations {

    private enum Unit {
        MONTH(Duration.ofDays(30)),
        WEEK(Duration.ofDays(7)),
        DAY(Duration.ofDays(1)),
        HOUR(Duration.ofHours(1)),
        MINUTE(Duration.ofMinutes(1)),
        SECOND(Duration.ofSeconds(1));

        private final Duration length;

        Unit(Duration length) {
            this.length = length;
        }

        static Unit parse(String raw) {
            String u = raw.endsWith("s") && raw.length() > 1 ? raw.substring(0, raw.length() - 1) : raw;
            return switch (u) {
                case "month" -> MONTH;
                case "week", "w" -> WEEK;
                case "day", "d" -> DAY;
                case "hour", "hr", "h" -> HOUR;
                case "minute", "min", "m" -> MINUTE;
                case "second", "sec", "s" -> SECOND;
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + raw);
            };
        }
    }

    private Durations() {
    }

    /**
     * @throws IllegalArgumentException if the text is blank, malformed, or not positive
     */
    public static Duration parse(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        Duration total;
        if (s.matches("\\d+")) {
            total = Duration.ofSeconds(parseCount(s, input));
        } else if (s.matches("\\d+\\s*[smhdw]")) {
            String digits = s.replaceAll("\\D", "");
            String unit = s.substring(s.length() - 1);
            total = Unit.parse(unit).length.multipliedBy(parseCount(digits, input));
        } else {
            total = parsePairs(s, input);
        }

        if (total.isZero() || total.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return total;
    }

    private static Duration parsePairs(String s, String input) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Set<Unit> seen = EnumSet.noneOf(Unit.class);
        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseCount(parts[i], input);
            Unit unit = Unit.parse(parts[i + 1]);
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit.name().toLowerCase(Locale.ROOT));
            }
            total = total.plus(unit.length.multipliedBy(n));
        }
        return total;
    }

    private static long parseCount(String digits, String input) {
        try {
            long n = Long.parseLong(digits);
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative: " + input);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in interval: " + input);
        }
    }
}
