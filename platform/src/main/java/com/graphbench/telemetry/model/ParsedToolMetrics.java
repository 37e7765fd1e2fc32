package com.graphbench.telemetry.model;

import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Fields recovered from a resource-usage report ({@code /usr/bin/time -v} or the plain
 * {@code elapsed_seconds:} fallback). Each field is independently present or absent.
 */
public record ParsedToolMetrics(
        OptionalDouble elapsedSeconds,
        OptionalDouble userCpuSeconds,
        OptionalDouble systemCpuSeconds,
        OptionalLong maxRssKb
) {
    private static final ParsedToolMetrics EMPTY = new ParsedToolMetrics(
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalLong.empty());

    public static ParsedToolMetrics empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * First value set for a field wins; later ones are ignored.
     */
    public static final class Builder {
        private OptionalDouble elapsedSeconds = OptionalDouble.empty();
        private OptionalDouble userCpuSeconds = OptionalDouble.empty();
        private OptionalDouble systemCpuSeconds = OptionalDouble.empty();
        private OptionalLong maxRssKb = OptionalLong.empty();

        public boolean hasElapsed() { return elapsedSeconds.isPresent(); }
        public boolean hasUserCpu() { return userCpuSeconds.isPresent(); }
        public boolean hasSystemCpu() { return systemCpuSeconds.isPresent(); }
        public boolean hasMaxRss() { return maxRssKb.isPresent(); }

        public Builder elapsedSeconds(OptionalDouble v) {
            if (!hasElapsed()) elapsedSeconds = v;
            return this;
        }

        public Builder userCpuSeconds(double v) {
            if (!hasUserCpu()) userCpuSeconds = OptionalDouble.of(v);
            return this;
        }

        public Builder systemCpuSeconds(double v) {
            if (!hasSystemCpu()) systemCpuSeconds = OptionalDouble.of(v);
            return this;
        }

        public Builder maxRssKb(long v) {
            if (!hasMaxRss()) maxRssKb = OptionalLong.of(v);
            return this;
        }

        public ParsedToolMetrics build() {
            return new ParsedToolMetrics(elapsedSeconds, userCpuSeconds, systemCpuSeconds, maxRssKb);
        }
    }
}
