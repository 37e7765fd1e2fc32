package com.graphbench.telemetry.parse;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line rules for resource-usage reports.
 *
 * Covers GNU {@code time -v} output, the {@code elapsed_seconds: N} line written when
 * GNU time is missing, and the POSIX {@code real N} form. Rules are matched against
 * trimmed lines; group 1 carries the raw value.
 */
public final class ToolReportPatterns {

    public enum Field {
        ELAPSED,
        USER_CPU,
        SYSTEM_CPU,
        MAX_RSS
    }

    public record Rule(Field field, Pattern pattern) {
        Optional<String> match(String line) {
            Matcher m = pattern.matcher(line);
            return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
        }
    }

    /**
     * A value captured from one line.
     */
    public record Hit(Field field, String value) {}

    public static final List<Rule> RULES = List.of(
            new Rule(Field.USER_CPU, Pattern.compile("^User time \\(seconds\\):\\s*(\\d+(?:\\.\\d+)?)$")),
            new Rule(Field.SYSTEM_CPU, Pattern.compile("^System time \\(seconds\\):\\s*(\\d+(?:\\.\\d+)?)$")),
            new Rule(Field.MAX_RSS, Pattern.compile("^Maximum resident set size \\(kbytes\\):\\s*(\\d+)$")),
            new Rule(Field.ELAPSED, Pattern.compile("^Elapsed \\(wall clock\\) time .*: (.+)$")),
            new Rule(Field.ELAPSED, Pattern.compile("^elapsed_seconds:\\s*(\\d+(?:\\.\\d+)?)$")),
            new Rule(Field.ELAPSED, Pattern.compile("^real\\s*(\\d+\\.\\d+)$"))
    );

    private ToolReportPatterns() {}

    /**
     * First rule matching {@code line}, if any.
     */
    public static Optional<Hit> match(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        for (Rule rule : RULES) {
            Optional<String> value = rule.match(trimmed);
            if (value.isPresent()) {
                return Optional.of(new Hit(rule.field(), value.get()));
            }
        }
        return Optional.empty();
    }
}
