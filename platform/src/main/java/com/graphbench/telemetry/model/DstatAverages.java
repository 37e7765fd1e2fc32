package com.graphbench.telemetry.model;

import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * Run-duration averages of host activity, from a dstat CSV or the sar fallback.
 * A field is absent when its source column was not found or had no samples.
 */
public record DstatAverages(
        OptionalDouble avgCpuUtil,
        OptionalDouble avgMemUsedMb,
        OptionalDouble avgDskReadKbps,
        OptionalDouble avgDskWritKbps,
        OptionalDouble avgNetRecvKbps,
        OptionalDouble avgNetSendKbps
) {
    private static final DstatAverages EMPTY = new DstatAverages(
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(),
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());

    public static DstatAverages empty() {
        return EMPTY;
    }

    /**
     * True when all six averages are absent.
     */
    public boolean isEmpty() {
        return Stream.of(avgCpuUtil, avgMemUsedMb, avgDskReadKbps, avgDskWritKbps, avgNetRecvKbps, avgNetSendKbps)
                .noneMatch(OptionalDouble::isPresent);
    }
}
