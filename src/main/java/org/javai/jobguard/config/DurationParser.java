package org.javai.jobguard.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration overrides written either as unit-suffixed strings ({@code 500ms}, {@code 5s},
 * {@code 1m30s}, {@code 1.5h}, {@code .5s}, {@code 250us}) or as ISO-8601 ({@code PT5S}).
 * A leading sign is accepted and fractions below a nanosecond are truncated.
 */
public final class DurationParser {

    private static final Pattern SEGMENT = Pattern.compile("(\\d*(?:\\.\\d*)?)(ns|us|\u00b5s|\u03bcs|ms|s|m|h)");

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "\u00b5s", 1_000L,
            "\u03bcs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L
    );

    private DurationParser() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if the text is neither format
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("duration must not be blank");
        }
        String trimmed = text.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid ISO-8601 duration: " + text, e);
            }
        }
        boolean negative = trimmed.startsWith("-");
        int start = negative || trimmed.startsWith("+") ? 1 : 0;
        if (trimmed.substring(start).equals("0")) {
            return Duration.ZERO;
        }

        Matcher matcher = SEGMENT.matcher(trimmed);
        BigDecimal totalNanos = BigDecimal.ZERO;
        int position = start;
        while (position < trimmed.length() && matcher.find(position)) {
            String number = matcher.group(1);
            if (matcher.start() != position || number.isEmpty() || number.equals(".")) {
                throw new IllegalArgumentException("invalid duration: " + text);
            }
            // sub-nanosecond fractions are truncated
            BigDecimal nanos = new BigDecimal(number)
                    .multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2))))
                    .setScale(0, RoundingMode.DOWN);
            totalNanos = totalNanos.add(nanos);
            position = matcher.end();
        }
        if (position == start || position != trimmed.length()) {
            throw new IllegalArgumentException("invalid duration: " + text + " (expected e.g. 500ms, 5s, 1m30s or PT5S)");
        }
        try {
            return Duration.ofNanos(negative ? totalNanos.negate().longValueExact() : totalNanos.longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("duration out of range: " + text, e);
        }
    }
}
