package com.media.lifecycle.policy;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses retention strings such as {@code 90d}, {@code 24h}, {@code 30m}, {@code 45s} or {@code never}.
 * A zero duration means retention is disabled.
 */
public final class RetentionDurations {

    public static final String NEVER = "never";

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)([dhms])$");

    private RetentionDurations() {
    }

    /**
     * Parses a retention string.
     *
     * @return the duration, {@link Duration#ZERO} for {@code never}
     * @throws InvalidDurationException if the string is empty, malformed or too large
     */
    public static Duration parse(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidDurationException("empty duration string");
        }
        if (NEVER.equals(value)) {
            return Duration.ZERO;
        }
        Matcher matcher = FORMAT.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidDurationException("invalid duration format: " + value
                    + " (expected format: 90d, 24h, 30m, or 'never')");
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidDurationException("invalid duration value: " + value, e);
        }
        try {
            return switch (matcher.group(2)) {
                case "d" -> Duration.ofDays(amount);
                case "h" -> Duration.ofHours(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofSeconds(amount);
            };
        } catch (ArithmeticException e) {
            throw new InvalidDurationException("duration out of range: " + value, e);
        }
    }
}
