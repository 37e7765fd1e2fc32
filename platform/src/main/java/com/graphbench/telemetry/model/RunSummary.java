package com.graphbench.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Terminal record of one supervised run, written once as {@code summary.json} when the child exits.
 */
@JsonPropertyOrder({
        "system", "dataset", "start_epoch", "end_epoch", "elapsed_sec",
        "peak_cpu_percent", "max_mem_used_mb",
        "disk_read_delta_bytes", "disk_write_delta_bytes",
        "net_sent_delta_bytes", "net_recv_delta_bytes",
        "samples", "cmd", "exit_code"
})
public record RunSummary(
        @JsonProperty("system") String system,
        @JsonProperty("dataset") String dataset,
        @JsonProperty("start_epoch") double startEpoch,
        @JsonProperty("end_epoch") double endEpoch,
        @JsonProperty("elapsed_sec") double elapsedSec,
        @JsonProperty("peak_cpu_percent") double peakCpuPercent,
        @JsonProperty("max_mem_used_mb") double maxMemUsedMb,
        @JsonProperty("disk_read_delta_bytes") long diskReadDeltaBytes,
        @JsonProperty("disk_write_delta_bytes") long diskWriteDeltaBytes,
        @JsonProperty("net_sent_delta_bytes") long netSentDeltaBytes,
        @JsonProperty("net_recv_delta_bytes") long netRecvDeltaBytes,
        @JsonProperty("samples") int samples,
        @JsonProperty("cmd") List<String> cmd,
        @JsonProperty("exit_code") int exitCode
) {
    public RunSummary {
        cmd = cmd != null ? List.copyOf(cmd) : List.of();
    }
}
