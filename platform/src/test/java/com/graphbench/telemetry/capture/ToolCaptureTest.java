package com.graphbench.telemetry.capture;

import com.graphbench.platform.config.TelemetryConfig;
import com.graphbench.telemetry.aggregate.MetricsAggregator;
import com.graphbench.telemetry.aggregate.RunLayout;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.ParsedToolMetrics;
import com.graphbench.telemetry.model.RunKey;
import com.graphbench.telemetry.parse.SarReportReader;
import com.graphbench.telemetry.parse.ToolReportReader;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ToolCaptureTest {

    private static final RunKey KEY = new RunKey("hadoop", "email-EuAll", "indegree");

    @TempDir
    Path dataRoot;

    @TempDir
    Path bin;

    private TelemetryConfig base;
    private RunLayout layout;

    @BeforeEach
    void setUp() {
        base = TelemetryConfig.from(ConfigFactory.parseString("""
                telemetry.capture {
                  time = "/nonexistent/time"
                  dstat = "/nonexistent/dstat"
                  sar = "/nonexistent/sar"
                  dstat-warmup = 0s
                  dstat-grace = 0s
                  stop-timeout = 2s
                }
                """)).withDataRoot(dataRoot);
        layout = new RunLayout(base.paths().metricsRoot(), base.frameworks());
    }

    private Path script(String name, String body) throws Exception {
        Path file = bin.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }

    private ToolCapture capture(TelemetryConfig config) {
        return ToolCapture.create(config.capture(), layout);
    }

    @Test
    void withoutProfilersWritesElapsedLineAndStatus() throws Exception {
        CaptureResult result = capture(base).capture(KEY, List.of("sh", "-c", "sleep 0.3; exit 3"));

        assertEquals(3, result.exitCode());
        assertFalse(result.timedByTool());
        assertTrue(result.monitors().isEmpty());
        assertEquals(List.of("3"), Files.readAllLines(layout.statusFile(KEY)));

        String timeLine = Files.readAllLines(layout.timeReport(KEY)).get(0);
        assertTrue(timeLine.matches("elapsed_seconds: \\d+\\.\\d{2}"), timeLine);
        ParsedToolMetrics parsed = new ToolReportReader(base.parse()).read(layout.timeReport(KEY));
        assertTrue(parsed.elapsedSeconds().getAsDouble() >= 0.25);

        assertFalse(Files.exists(layout.dstatLog(KEY)));
        assertFalse(Files.exists(layout.sarReports(KEY).cpu()));
    }

    @Test
    void commandThatCannotStartReportsNotFound() throws Exception {
        CaptureResult result = capture(base).capture(KEY, List.of("/nonexistent/not-a-real-binary"));

        assertEquals(ToolCapture.EXIT_NOT_FOUND, result.exitCode());
        assertEquals(List.of("127"), Files.readAllLines(layout.statusFile(KEY)));
        assertTrue(Files.isRegularFile(layout.timeReport(KEY)));
    }

    @Test
    void timeToolWrapsTheCommand() throws Exception {
        Path time = script("time", """
                [ "$1" = "-v" ] && [ "$2" = "-o" ] || exit 64
                out=$3
                shift 3
                "$@"
                code=$?
                printf '\\tElapsed (wall clock) time (h:mm:ss or m:ss): 0:01.50\\n' > "$out"
                printf '\\tMaximum resident set size (kbytes): 2048\\n' >> "$out"
                exit $code
                """);
        TelemetryConfig config = base.with("capture.time", time.toString());

        CaptureResult result = capture(config).capture(KEY, List.of("sh", "-c", "exit 5"));

        assertEquals(5, result.exitCode());
        assertTrue(result.timedByTool());
        assertEquals(List.of("5"), Files.readAllLines(layout.statusFile(KEY)));
        ParsedToolMetrics parsed = new ToolReportReader(config.parse()).read(result.timeReport());
        assertEquals(1.5, parsed.elapsedSeconds().getAsDouble(), 1e-9);
        assertEquals(2048L, parsed.maxRssKb().getAsLong());
    }

    @Test
    void monitorsRunAroundTheCommandAndAreStopped() throws Exception {
        Path dstat = script("dstat", """
                trap 'exit 0' INT TERM
                args="$*"
                while [ $# -gt 0 ]; do
                  [ "$1" = "--output" ] && out=$2
                  shift
                done
                echo "$args" > "$out"
                while true; do sleep 0.1; done
                """);
        Path sar = script("sar", """
                trap 'exit 0' INT TERM
                echo "Linux LC_ALL=$LC_ALL $*"
                while true; do sleep 0.1; done
                """);
        TelemetryConfig config = base
                .with("capture.dstat", dstat.toString())
                .with("capture.sar", sar.toString());

        CaptureResult result = capture(config).capture(KEY, List.of("sleep", "1"));

        assertEquals(0, result.exitCode());
        assertEquals(5, result.monitors().size());

        Path dstatLog = layout.dstatLog(KEY);
        assertEquals("--time --cpu --mem --io --net --output " + dstatLog + " 1",
                Files.readAllLines(dstatLog).get(0));

        SarReportReader.Reports reports = layout.sarReports(KEY);
        assertEquals("Linux LC_ALL=C -u 1", Files.readAllLines(reports.cpu()).get(0));
        assertEquals("Linux LC_ALL=C -r 1", Files.readAllLines(reports.memory()).get(0));
        assertEquals("Linux LC_ALL=C -b 1", Files.readAllLines(reports.disk()).get(0));
        assertEquals("Linux LC_ALL=C -n DEV 1", Files.readAllLines(reports.network()).get(0));
    }

    @Test
    void capturedPhaseIsPickedUpByTheAggregator() throws Exception {
        capture(base).capture(KEY, List.of("true"));

        MetricsRecord row = MetricsAggregator.create(base).collect().get(KEY);

        assertNotNull(row);
        assertTrue(row.tool().elapsedSeconds().isPresent());
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> capture(base).capture(KEY, List.of()));
    }
}
