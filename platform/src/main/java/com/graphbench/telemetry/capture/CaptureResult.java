package com.graphbench.telemetry.capture;

import com.graphbench.telemetry.model.RunKey;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one captured phase.
 *
 * @param exitCode    the command's exit code, 127 when it could not be launched
 * @param timedByTool true when the time report came from GNU time rather than the elapsed-seconds fallback
 * @param monitors    profiler logs written next to the time report
 */
public record CaptureResult(
        RunKey key,
        int exitCode,
        boolean timedByTool,
        Path timeReport,
        Path statusFile,
        List<Path> monitors
) {
    public CaptureResult {
        monitors = List.copyOf(monitors);
    }
}
