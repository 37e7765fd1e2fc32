package com.graphbench.telemetry.sampler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphbench.platform.config.TelemetryConfig.SamplerConfig;
import com.graphbench.telemetry.model.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessSupervisorTest {

    @TempDir
    Path outRoot;

    /**
     * Counters that grow by a fixed step on every read.
     */
    private static final class SteppingCounters implements HostCounters {
        private int reads;

        @Override
        public CounterSnapshot read() {
            reads++;
            return new CounterSnapshot(10.0 * (reads % 5), 1000.0 + reads, 12.5,
                    100L * reads, 200L * reads, 50L * reads, 75L * reads);
        }
    }

    private ProcessSupervisor supervisor(Duration interval) {
        return ProcessSupervisor.withCounters(
                new SamplerConfig(interval, Duration.ofMillis(200), outRoot), new SteppingCounters());
    }

    @Test
    void samplesUntilExitAndWritesSummary() throws Exception {
        RunSummary summary = supervisor(Duration.ofMillis(200))
                .supervise("spark", "email-EuAll", List.of("sleep", "1"));

        assertTrue(summary.elapsedSec() >= 0.9, "elapsed " + summary.elapsedSec());
        assertTrue(summary.elapsedSec() < 3.0, "elapsed " + summary.elapsedSec());
        assertTrue(summary.samples() >= 2);
        assertEquals(0, summary.exitCode());
        assertTrue(summary.diskReadDeltaBytes() > 0);
        assertEquals(40.0, summary.peakCpuPercent(), 1e-9);

        Path runDir = outRoot.resolve("spark/email-EuAll");
        List<String> rows = Files.readAllLines(runDir.resolve(ProcessSupervisor.TIMESERIES_FILE));
        assertEquals(String.join(",", ProcessSupervisor.TIMESERIES_HEADER), rows.get(0));
        assertEquals(summary.samples() + 1, rows.size());

        JsonNode json = new ObjectMapper().readTree(runDir.resolve(ProcessSupervisor.SUMMARY_FILE).toFile());
        assertEquals("spark", json.get("system").asText());
        assertEquals(summary.samples(), json.get("samples").asInt());
        assertEquals("sleep", json.get("cmd").get(0).asText());
        assertTrue(json.has("disk_read_delta_bytes"));
    }

    @Test
    void elapsedTimesIncrease() throws Exception {
        supervisor(Duration.ofMillis(200)).supervise("hadoop", "ds", List.of("sleep", "0.5"));

        List<String> rows = Files.readAllLines(outRoot.resolve("hadoop/ds").resolve(ProcessSupervisor.TIMESERIES_FILE));
        double previous = -1;
        for (String row : rows.subList(1, rows.size())) {
            double t = Double.parseDouble(row.split(",")[0]);
            assertTrue(t > previous, "t_sec must increase: " + rows);
            previous = t;
        }
    }

    @Test
    void recordsChildExitCode() {
        RunSummary summary = supervisor(Duration.ofMillis(200))
                .supervise("hadoop", "ds", List.of("sh", "-c", "exit 3"));

        assertEquals(3, summary.exitCode());
        assertTrue(summary.samples() >= 1);
    }

    @Test
    void launchFailureWritesNothing() {
        ProcessSupervisor supervisor = supervisor(Duration.ofSeconds(1));

        assertThrows(SupervisionException.class,
                () -> supervisor.supervise("spark", "ds", List.of("/nonexistent/not-a-real-binary")));
        assertFalse(Files.exists(outRoot.resolve("spark")));
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> supervisor(Duration.ofSeconds(1)).supervise("spark", "ds", List.of()));
    }
}
