package com.example.LlmCouncil.util;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls numeric answers out of free-form model replies.
 */
public final class NumberExtractor {

    private NumberExtractor() {
    }

    /** Plausible quote range; anything outside falls back to the default. */
    public static final int MIN_QUOTED_TOKENS = 100;
    public static final int MAX_QUOTED_TOKENS = 10_000;

    /**
     * Pattern for integers, after thousands separators are removed.
     */
    private static final Pattern INTEGER = Pattern.compile("\\d+");

    /**
     * Pattern for decimals such as "42", "42.5" or ".5".
     */
    private static final Pattern DECIMAL = Pattern.compile("-?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    /**
     * Token count from a quote reply: first integer, accepted only within
     * [{@value #MIN_QUOTED_TOKENS}, {@value #MAX_QUOTED_TOKENS}].
     */
    public static int parseTokenCount(String text, int defaultValue) {
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        String cleaned = text.trim().replace(",", "").replace("_", "");
        Matcher matcher = INTEGER.matcher(cleaned);
        if (!matcher.find()) {
            return defaultValue;
        }
        try {
            int count = Integer.parseInt(matcher.group());
            return count >= MIN_QUOTED_TOKENS && count <= MAX_QUOTED_TOKENS ? count : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * First decimal number in the text, if any.
     */
    public static OptionalDouble firstNumber(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = DECIMAL.matcher(text.replace(",", ""));
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * First number clamped to the percentage range [0, 100].
     */
    public static Optional<Double> percentage(String text) {
        OptionalDouble value = firstNumber(text);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(clampPercent(value.getAsDouble()));
    }

    public static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
