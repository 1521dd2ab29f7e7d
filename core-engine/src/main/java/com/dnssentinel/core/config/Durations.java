package com.dnssentinel.core.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the duration strings used throughout the YAML configuration.
 *
 * <p>
 * Two notations are accepted:
 * </p>
 * <ul>
 * <li>unit-suffixed segments, optionally chained: {@code 250ms}, {@code 30s},
 * {@code 5m}, {@code 1h30m}, {@code 7d}</li>
 * <li>ISO-8601, e.g. {@code PT5M}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Durations {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|s|m|h|d)");

    private Durations() {
        // utility class - not instantiable
    }

    /**
     * Parse a duration string.
     *
     * @param text the duration text; must not be {@code null}
     * @return the parsed, non-negative duration
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parse(String text) {
        Objects.requireNonNull(text, "Duration text must not be null");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        if (trimmed.charAt(0) == 'P' || trimmed.charAt(0) == 'p') {
            try {
                return requireNonNegative(Duration.parse(trimmed.toUpperCase(Locale.ROOT)), text);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: '" + text + "'", e);
            }
        }
        if ("0".equals(trimmed)) {
            return Duration.ZERO;
        }

        Matcher matcher = SEGMENT.matcher(trimmed.toLowerCase(Locale.ROOT));
        Duration total = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                break;
            }
            total = total.plus(segment(Double.parseDouble(matcher.group(1)), matcher.group(2)));
            position = matcher.end();
        }
        if (position == 0 || position != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: '" + text
                    + "'. Expected e.g. 30s, 5m, 1h30m, 7d or PT5M");
        }
        return total;
    }

    /**
     * Parse {@code text}, falling back to {@code defaultValue} when it is
     * {@code null} or blank.
     */
    public static Duration parseOrDefault(String text, Duration defaultValue) {
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        return parse(text);
    }

    /**
     * @return {@code true} if {@code text} is a parseable duration
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (IllegalArgumentException | NullPointerException e) {
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Duration segment(double amount, String unit) {
        double millis = switch (unit) {
            case "ms" -> amount;
            case "s" -> amount * 1_000;
            case "m" -> amount * 60_000;
            case "h" -> amount * 3_600_000;
            case "d" -> amount * 86_400_000;
            default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
        return Duration.ofMillis(Math.round(millis));
    }

    private static Duration requireNonNegative(Duration duration, String text) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration must not be negative: '" + text + "'");
        }
        return duration;
    }
}
