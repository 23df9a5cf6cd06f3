package work.agentflow.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations (e.g. {@code 500ms}, {@code 30s}, {@code 2m}).
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        try {
            return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration is too large: " + raw, ex);
        }
    }
}
