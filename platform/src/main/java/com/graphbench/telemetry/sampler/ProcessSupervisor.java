package com.graphbench.telemetry.sampler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.graphbench.platform.base.Result;
import com.graphbench.platform.config.TelemetryConfig.SamplerConfig;
import com.graphbench.telemetry.model.RunSummary;
import com.graphbench.telemetry.model.Sample;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static com.graphbench.platform.observe.Log.*;

/**
 * Runs one command to completion while sampling host counters at a fixed cadence.
 *
 * Output structure:
 *   {outRoot}/{system}/{dataset}/timeseries.csv
 *   {outRoot}/{system}/{dataset}/summary.json
 *
 * Sampling is a single-threaded polling loop: check liveness, take a sample, sleep one
 * interval while the child is alive. The last sample is taken after exit is observed.
 * There is no timeout; a caller wanting bounded runs must impose one externally.
 */
public final class ProcessSupervisor {

    public static final String TIMESERIES_FILE = "timeseries.csv";
    public static final String SUMMARY_FILE = "summary.json";

    public static final String[] TIMESERIES_HEADER = {
            "t_sec", "cpu_percent", "mem_used_mb", "mem_percent",
            "disk_read_bytes", "disk_write_bytes", "net_sent_bytes", "net_recv_bytes"
    };

    private static final CSVFormat TIMESERIES_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(TIMESERIES_HEADER)
            .setRecordSeparator('\n')
            .build();

    private static final ObjectMapper mapper = createMapper();

    private final SamplerConfig config;
    private final HostCounters counters;

    // ========================================================================
    // Static Factories
    // ========================================================================

    public static ProcessSupervisor create(SamplerConfig config) {
        return new ProcessSupervisor(config, HostCounters.system());
    }

    public static ProcessSupervisor withCounters(SamplerConfig config, HostCounters counters) {
        return new ProcessSupervisor(config, counters);
    }

    private ProcessSupervisor(SamplerConfig config, HostCounters counters) {
        this.config = config;
        this.counters = counters;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return mapper;
    }

    public Path runDirectory(String system, String dataset) {
        return config.outRoot().resolve(system).resolve(dataset);
    }

    // ========================================================================
    // Supervision
    // ========================================================================

    /**
     * Launch {@code command}, sample until it exits and write the time series and summary.
     *
     * @throws SupervisionException if the command cannot be launched (nothing is written),
     *         the run directory cannot be written, or the calling thread is interrupted
     */
    public RunSummary supervise(String system, String dataset, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Duration interval = config.effectiveInterval();

        CounterSnapshot baseline = counters.read();
        long startNanos = System.nanoTime();
        double startEpoch = epochSeconds();

        Process process;
        try {
            process = new ProcessBuilder(command).inheritIO().start();
        } catch (IOException | RuntimeException e) {
            throw new SupervisionException("Failed to launch " + String.join(" ", command), e);
        }
        info("Supervising {} for {}/{} (pid {}, every {} ms)",
                command.get(0), system, dataset, process.pid(), interval.toMillis());

        Path runDir = runDirectory(system, dataset);
        Peaks peaks = new Peaks();
        try {
            Files.createDirectories(runDir);
            try (BufferedWriter out = Files.newBufferedWriter(runDir.resolve(TIMESERIES_FILE), StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(out, TIMESERIES_FORMAT)) {
                pollUntilExit(process, startNanos, interval, printer, peaks);
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new SupervisionException("Cannot write time series under " + runDir, e);
        }

        CounterSnapshot end = counters.read();
        double elapsed = secondsSince(startNanos);
        RunSummary summary = new RunSummary(
                system,
                dataset,
                startEpoch,
                epochSeconds(),
                elapsed,
                peaks.cpuPercent,
                peaks.memUsedMb,
                delta(end.diskReadBytes(), baseline.diskReadBytes()),
                delta(end.diskWriteBytes(), baseline.diskWriteBytes()),
                delta(end.netSentBytes(), baseline.netSentBytes()),
                delta(end.netRecvBytes(), baseline.netRecvBytes()),
                peaks.samples,
                command,
                process.exitValue()
        );

        Path summaryPath = runDir.resolve(SUMMARY_FILE);
        Result.of(() -> {
                    mapper.writeValue(summaryPath.toFile(), summary);
                    return summaryPath;
                })
                .onSuccess(p -> info("Run finished in {} s with exit code {}; summary at {}",
                        format(elapsed, 3), summary.exitCode(), p))
                .onFailure(e -> {
                    throw new SupervisionException("Cannot write " + summaryPath, e);
                });
        return summary;
    }

    private void pollUntilExit(Process process, long startNanos, Duration interval,
                               CSVPrinter printer, Peaks peaks) throws IOException {
        while (true) {
            boolean alive = process.isAlive();
            Sample sample = sample(startNanos);
            printer.printRecord(row(sample));
            printer.flush();
            peaks.add(sample);
            if (!alive) {
                return;
            }
            if (Result.sleep(interval).isFailure()) {
                process.destroyForcibly();
                throw new SupervisionException("Interrupted while supervising pid " + process.pid());
            }
        }
    }

    private Sample sample(long startNanos) {
        CounterSnapshot s = counters.read();
        return new Sample(
                secondsSince(startNanos),
                s.cpuPercent(),
                s.memUsedMb(),
                s.memPercent(),
                s.diskReadBytes(),
                s.diskWriteBytes(),
                s.netSentBytes(),
                s.netRecvBytes()
        );
    }

    private static List<String> row(Sample s) {
        return List.of(
                format(s.elapsedSec(), 3),
                format(s.cpuPercent(), 2),
                format(s.memUsedMb(), 2),
                format(s.memPercent(), 2),
                Long.toString(s.diskReadBytes()),
                Long.toString(s.diskWriteBytes()),
                Long.toString(s.netSentBytes()),
                Long.toString(s.netRecvBytes())
        );
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static final class Peaks {
        double cpuPercent;
        double memUsedMb;
        int samples;

        void add(Sample s) {
            cpuPercent = Math.max(cpuPercent, s.cpuPercent());
            memUsedMb = Math.max(memUsedMb, s.memUsedMb());
            samples++;
        }
    }

    /** Never negative: an unreadable end counter reads as zero. */
    private static long delta(long end, long start) {
        return Math.max(0L, end - start);
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static double epochSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
