package com.graphbench.telemetry.parse;

import com.graphbench.platform.config.TelemetryConfig.ParseConfig;
import com.graphbench.platform.config.TelemetryConfig.UnparsableDuration;
import com.graphbench.telemetry.model.ParsedToolMetrics;

import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;

import static com.graphbench.platform.observe.Log.debug;

/**
 * Reads elapsed time, user/system CPU seconds and peak RSS from a resource-usage report.
 *
 * Single pass; the first line matching a field sets it. A missing report yields
 * {@link ParsedToolMetrics#empty()}.
 */
public final class ToolReportReader {

    private final UnparsableDuration unparsableDuration;

    public ToolReportReader(ParseConfig config) {
        this.unparsableDuration = config.unparsableDuration();
    }

    public ParsedToolMetrics read(Path report) {
        return parse(TextFiles.readLines(report));
    }

    public ParsedToolMetrics parse(List<String> lines) {
        ParsedToolMetrics.Builder builder = ParsedToolMetrics.builder();
        for (String line : lines) {
            ToolReportPatterns.match(line).ifPresent(hit -> apply(builder, hit));
        }
        return builder.build();
    }

    private void apply(ParsedToolMetrics.Builder builder, ToolReportPatterns.Hit hit) {
        switch (hit.field()) {
            case ELAPSED -> builder.elapsedSeconds(elapsed(hit.value()));
            case USER_CPU -> builder.userCpuSeconds(Double.parseDouble(hit.value()));
            case SYSTEM_CPU -> builder.systemCpuSeconds(Double.parseDouble(hit.value()));
            case MAX_RSS -> maxRss(builder, hit.value());
        }
    }

    private OptionalDouble elapsed(String raw) {
        OptionalDouble seconds = DurationParser.parseStrict(raw);
        if (seconds.isEmpty()) {
            debug("Unparsable elapsed time '{}'", raw);
            return unparsableDuration == UnparsableDuration.ZERO ? OptionalDouble.of(0.0) : seconds;
        }
        return seconds;
    }

    private static void maxRss(ParsedToolMetrics.Builder builder, String raw) {
        try {
            builder.maxRssKb(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            debug("Max RSS '{}' out of range", raw);
        }
    }
}
