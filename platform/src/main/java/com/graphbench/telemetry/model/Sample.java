package com.graphbench.telemetry.model;

/**
 * One host resource snapshot taken while a supervised command runs.
 *
 * Byte counters are cumulative host totals, not per-interval rates.
 */
public record Sample(
        double elapsedSec,
        double cpuPercent,
        double memUsedMb,
        double memPercent,
        long diskReadBytes,
        long diskWriteBytes,
        long netSentBytes,
        long netRecvBytes
) {
}
