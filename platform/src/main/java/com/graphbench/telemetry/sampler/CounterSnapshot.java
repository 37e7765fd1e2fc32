package com.graphbench.telemetry.sampler;

/**
 * One reading of host counters. Byte counters are cumulative since boot.
 */
public record CounterSnapshot(
        double cpuPercent,
        double memUsedMb,
        double memPercent,
        long diskReadBytes,
        long diskWriteBytes,
        long netSentBytes,
        long netRecvBytes
) {
    public static final CounterSnapshot ZERO = new CounterSnapshot(0.0, 0.0, 0.0, 0L, 0L, 0L, 0L);
}
