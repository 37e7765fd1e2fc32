package com.graphbench.telemetry.parse;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Converts the time formats found in profiler output to seconds.
 *
 * <ul>
 *   <li>{@code H:MM:SS[.f]} - {@code 1:02:03} is 3723.0</li>
 *   <li>{@code M:SS[.f]} - {@code 0:05.50} is 5.5</li>
 *   <li>bare decimal - {@code 12.25} is 12.25</li>
 * </ul>
 *
 * Fields are split on {@code :}; the decimal separator is always {@code .}.
 */
public final class DurationParser {

    private static final Pattern WHOLE = Pattern.compile("\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private DurationParser() {}

    /**
     * Seconds for {@code token}, or 0.0 when it matches none of the accepted forms.
     */
    public static double parse(String token) {
        return parseStrict(token).orElse(0.0);
    }

    /**
     * Seconds for {@code token}, or empty when it matches none of the accepted forms.
     */
    public static OptionalDouble parseStrict(String token) {
        if (token == null) {
            return OptionalDouble.empty();
        }
        String[] parts = token.trim().split(":", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return switch (parts.length) {
            case 3 -> hms(parts[0], parts[1], parts[2]);
            case 2 -> hms("0", parts[0], parts[1]);
            case 1 -> decimal(parts[0]);
            default -> OptionalDouble.empty();
        };
    }

    private static OptionalDouble hms(String hours, String minutes, String seconds) {
        if (!WHOLE.matcher(hours).matches() || !WHOLE.matcher(minutes).matches()) {
            return OptionalDouble.empty();
        }
        OptionalDouble sec = decimal(seconds);
        if (sec.isEmpty()) {
            return sec;
        }
        return OptionalDouble.of(Long.parseLong(hours) * 3600.0 + Long.parseLong(minutes) * 60.0 + sec.getAsDouble());
    }

    private static OptionalDouble decimal(String s) {
        if (!DECIMAL.matcher(s).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(s));
    }
}
