package com.graphbench.telemetry.aggregate;

import java.nio.file.Path;

/**
 * Where the summary table landed. {@code usedFallback} is true when the configured
 * destination was rejected and the alternate file was written instead.
 */
public record TableWriteResult(Path path, boolean usedFallback, int rows) {
}
