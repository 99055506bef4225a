package work.cacm.engine.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses step timeouts written as {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h}, plain milliseconds or ISO-8601.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("pt") || trimmed.startsWith("p")) {
            try {
                return Optional.of(requireNonNegative(Duration.parse(trimmed.toUpperCase(Locale.ROOT)), raw));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid duration: " + raw, ex);
            }
        }
        long multiplier = 1L;
        String digits = trimmed;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        try {
            return Optional.of(requireNonNegative(Duration.ofMillis(Math.multiplyExact(value, multiplier)), raw));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration out of range: " + raw, ex);
        }
    }

    private static Duration requireNonNegative(Duration duration, String raw) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return duration;
    }
}
