package com.graphbench.telemetry.model;

import java.util.Objects;

/**
 * Canonical join of one (framework, dataset, phase) with its tool-report fields and
 * host activity averages. One row of the summary table.
 */
public record MetricsRecord(
        RunKey key,
        ParsedToolMetrics tool,
        DstatAverages averages
) {
    public MetricsRecord {
        Objects.requireNonNull(key, "key");
        tool = tool != null ? tool : ParsedToolMetrics.empty();
        averages = averages != null ? averages : DstatAverages.empty();
    }

    public String framework() { return key.framework(); }
    public String dataset()   { return key.dataset(); }
    public String phase()     { return key.phase(); }
}
