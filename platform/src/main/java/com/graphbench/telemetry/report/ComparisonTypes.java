package com.graphbench.telemetry.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Framework comparison types, serialized as {@code comparison.json}.
 *
 * Absent values serialize as {@code null}; they are never folded into zero.
 */
public final class ComparisonTypes {

    private ComparisonTypes() {}

    // ========================================================================
    // Per framework and dataset
    // ========================================================================

    /**
     * All phases of one framework on one dataset combined: times and CPU seconds summed,
     * max RSS the largest phase value, host averages the mean over phases that have them.
     */
    @JsonPropertyOrder({
            "framework", "dataset", "phases", "elapsed_seconds", "cpu_user_s", "cpu_sys_s", "max_rss_kb",
            "avg_cpu_util", "avg_mem_used_mb", "avg_dsk_read_kbps", "avg_dsk_writ_kbps",
            "avg_net_recv_kbps", "avg_net_send_kbps"
    })
    public record FrameworkTotals(
            @JsonProperty("framework") String framework,
            @JsonProperty("dataset") String dataset,
            @JsonProperty("phases") List<String> phases,
            @JsonProperty("elapsed_seconds") OptionalDouble elapsedSeconds,
            @JsonProperty("cpu_user_s") OptionalDouble cpuUserSeconds,
            @JsonProperty("cpu_sys_s") OptionalDouble cpuSysSeconds,
            @JsonProperty("max_rss_kb") OptionalLong maxRssKb,
            @JsonProperty("avg_cpu_util") OptionalDouble avgCpuUtil,
            @JsonProperty("avg_mem_used_mb") OptionalDouble avgMemUsedMb,
            @JsonProperty("avg_dsk_read_kbps") OptionalDouble avgDskReadKbps,
            @JsonProperty("avg_dsk_writ_kbps") OptionalDouble avgDskWritKbps,
            @JsonProperty("avg_net_recv_kbps") OptionalDouble avgNetRecvKbps,
            @JsonProperty("avg_net_send_kbps") OptionalDouble avgNetSendKbps
    ) {
        public FrameworkTotals {
            phases = List.copyOf(phases);
        }
    }

    // ========================================================================
    // Per dataset
    // ========================================================================

    /**
     * Frameworks measured on one dataset, ordered by name. {@code fastest} is set when at
     * least two frameworks have an elapsed time and one is strictly faster;
     * {@code elapsedGapSeconds} is how far the runner-up is behind it.
     */
    @JsonPropertyOrder({"dataset", "fastest", "elapsed_gap_seconds", "frameworks"})
    public record DatasetComparison(
            @JsonProperty("dataset") String dataset,
            @JsonProperty("fastest") Optional<String> fastest,
            @JsonProperty("elapsed_gap_seconds") OptionalDouble elapsedGapSeconds,
            @JsonProperty("frameworks") List<FrameworkTotals> frameworks
    ) {
        public DatasetComparison {
            frameworks = List.copyOf(frameworks);
        }

        public boolean isTie() {
            return fastest.isEmpty() && elapsedGapSeconds.isPresent();
        }
    }

    // ========================================================================
    // Report
    // ========================================================================

    @JsonPropertyOrder({"generated_at", "source", "datasets"})
    public record ComparisonReport(
            @JsonProperty("generated_at") Instant generatedAt,
            @JsonProperty("source") String source,
            @JsonProperty("datasets") List<DatasetComparison> datasets
    ) {
        public ComparisonReport {
            datasets = List.copyOf(datasets);
        }

        public static ComparisonReport of(Path source, List<DatasetComparison> datasets) {
            return new ComparisonReport(Instant.now(), source != null ? source.toString() : null, datasets);
        }
    }
}
