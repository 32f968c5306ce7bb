package com.conduit.grpc.codec;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;

/**
 * Text form of durations exchanged with peers, e.g. {@code 500ms}, {@code 1m30s}, {@code 1.5s}.
 * <p>
 * A sequence of decimal numbers, each with an optional fraction and a unit suffix
 * ({@code ns}, {@code us}/{@code µs}, {@code ms}, {@code s}, {@code m}, {@code h}), with an optional
 * leading sign. {@code 0} is accepted without a unit.
 */
public final class DurationFormat {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;

    private static final Map<String, Long> UNITS = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "μs", 1_000L,
            "ms", 1_000_000L,
            "s", NANOS_PER_SECOND,
            "m", NANOS_PER_MINUTE,
            "h", NANOS_PER_HOUR);

    private DurationFormat() {
        // utility class
    }

    /**
     * Formats a duration with the largest units first, e.g. {@code 1h2m3.5s}. Durations under a
     * second use the largest fitting sub-second unit, e.g. {@code 1.5ms}.
     */
    public static String format(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        StringBuilder out = new StringBuilder();
        if (nanos < 0) {
            out.append('-');
        }
        BigDecimal magnitude = BigDecimal.valueOf(nanos).abs();
        if (magnitude.compareTo(BigDecimal.valueOf(NANOS_PER_SECOND)) < 0) {
            long u = magnitude.longValueExact();
            if (u < 1_000L) {
                return out.append(u).append("ns").toString();
            }
            if (u < 1_000_000L) {
                return out.append(decimal(magnitude, 3)).append("µs").toString();
            }
            return out.append(decimal(magnitude, 6)).append("ms").toString();
        }
        BigDecimal[] hours = magnitude.divideAndRemainder(BigDecimal.valueOf(NANOS_PER_HOUR));
        BigDecimal[] minutes = hours[1].divideAndRemainder(BigDecimal.valueOf(NANOS_PER_MINUTE));
        boolean hasHours = hours[0].signum() > 0;
        if (hasHours) {
            out.append(hours[0].toPlainString()).append('h');
        }
        if (hasHours || minutes[0].signum() > 0) {
            out.append(minutes[0].toPlainString()).append('m');
        }
        return out.append(decimal(minutes[1], 9)).append('s').toString();
    }

    /**
     * Parses a duration.
     *
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("invalid duration \"\"");
        }
        int i = 0;
        boolean negative = false;
        if (text.charAt(0) == '-' || text.charAt(0) == '+') {
            negative = text.charAt(0) == '-';
            i++;
        }
        if (text.substring(i).equals("0")) {
            return Duration.ZERO;
        }
        if (i == text.length()) {
            throw invalid(text);
        }
        BigDecimal total = BigDecimal.ZERO;
        while (i < text.length()) {
            int start = i;
            while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                i++;
            }
            String number = text.substring(start, i);
            if (number.isEmpty() || number.equals(".") || number.indexOf('.') != number.lastIndexOf('.')) {
                throw invalid(text);
            }
            int unitStart = i;
            while (i < text.length() && !Character.isDigit(text.charAt(i)) && text.charAt(i) != '.') {
                i++;
            }
            Long unit = UNITS.get(text.substring(unitStart, i));
            if (unit == null) {
                throw new IllegalArgumentException(
                        "unknown unit \"%s\" in duration \"%s\"".formatted(text.substring(unitStart, i), text));
            }
            total = total.add(new BigDecimal(number).multiply(BigDecimal.valueOf(unit)));
        }
        try {
            long nanos = total.setScale(0, RoundingMode.DOWN).longValueExact();
            return Duration.ofNanos(negative ? -nanos : nanos);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("duration out of range: \"%s\"".formatted(text), e);
        }
    }

    private static String decimal(BigDecimal nanos, int scale) {
        BigDecimal value = nanos.movePointLeft(scale).stripTrailingZeros();
        return value.scale() < 0 ? value.setScale(0).toPlainString() : value.toPlainString();
    }

    private static IllegalArgumentException invalid(String text) {
        return new IllegalArgumentException("invalid duration \"%s\"".formatted(text));
    }
}
