package com.graphbench.telemetry.capture;

import com.graphbench.platform.base.Result;
import com.graphbench.platform.config.TelemetryConfig.CaptureConfig;
import com.graphbench.telemetry.aggregate.RunLayout;
import com.graphbench.telemetry.model.RunKey;
import com.graphbench.telemetry.parse.SarReportReader;
import com.graphbench.telemetry.sampler.SupervisionException;

import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.graphbench.platform.observe.Log.*;

/**
 * Runs one benchmark phase under the external profilers and leaves their output where
 * {@link RunLayout} reads it.
 *
 * Output structure:
 *   {metricsRoot}/{framework}/{dataset}/{phase}.time        GNU time -v, or "elapsed_seconds: N"
 *   {metricsRoot}/{framework}/{dataset}/{phase}.dstat.csv   when dstat is installed
 *   {metricsRoot}/{framework}/{dataset}/{phase}.sar.*.txt   when sar is installed
 *   {metricsRoot}/{framework}/{dataset}/{phase}.status      exit code of the command
 *
 * Monitors start before the command and are stopped with SIGINT once it exits, so dstat
 * finishes its CSV and sar prints its Average rows. A monitor that ignores SIGINT is
 * terminated after {@code capture.stop-timeout}.
 */
public final class ToolCapture {

    /** Exit code reported when the command cannot be launched, as a shell would. */
    public static final int EXIT_NOT_FOUND = 127;

    private final CaptureConfig config;
    private final RunLayout layout;

    // ========================================================================
    // Static Factories
    // ========================================================================

    public static ToolCapture create(CaptureConfig config, RunLayout layout) {
        return new ToolCapture(config, layout);
    }

    private ToolCapture(CaptureConfig config, RunLayout layout) {
        this.config = config;
        this.layout = layout;
    }

    private record Monitor(String name, Process process, Path output) {}

    private record Timed(int exitCode, boolean byTool) {}

    // ========================================================================
    // Capture
    // ========================================================================

    /**
     * Run {@code command} to completion with every available profiler attached.
     *
     * @throws SupervisionException if the run directory or status file cannot be written,
     *         or the calling thread is interrupted while the command runs
     */
    public CaptureResult capture(RunKey key, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Path dir = layout.runDirectory(key);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SupervisionException("Cannot create " + dir, e);
        }

        List<Monitor> monitors = new ArrayList<>();
        Timed timed;
        try {
            startDstat(key).ifPresent(monitors::add);
            monitors.addAll(startSar(key));
            info("Capturing {} with {} monitor(s): {}", key, monitors.size(), String.join(" ", command));
            timed = runTimed(key, command);
        } finally {
            stopAll(monitors);
        }

        Path status = layout.statusFile(key);
        try {
            Files.writeString(status, timed.exitCode() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SupervisionException("Cannot write " + status, e);
        }

        List<Path> written = monitors.stream()
                .map(Monitor::output)
                .filter(Files::isRegularFile)
                .toList();
        info("Captured {} with exit code {} ({} monitor logs)", key, timed.exitCode(), written.size());
        return new CaptureResult(key, timed.exitCode(), timed.byTool(), layout.timeReport(key), status, written);
    }

    // ========================================================================
    // Command
    // ========================================================================

    private Timed runTimed(RunKey key, List<String> command) {
        Path timeFile = layout.timeReport(key);
        Optional<Path> time = Executables.resolve(config.timeTool());
        if (time.isPresent()) {
            List<String> argv = new ArrayList<>(List.of(time.get().toString(), "-v", "-o", timeFile.toString()));
            argv.addAll(command);
            return new Timed(run(argv), true);
        }

        debug("{} not found, timing {} without it", config.timeTool(), key);
        long start = System.nanoTime();
        int exitCode = run(command);
        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        String line = String.format(Locale.ROOT, "elapsed_seconds: %.2f%n", elapsed);
        try {
            Files.writeString(timeFile, line, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SupervisionException("Cannot write " + timeFile, e);
        }
        return new Timed(exitCode, false);
    }

    private static int run(List<String> argv) {
        Process process;
        try {
            process = new ProcessBuilder(argv).inheritIO().start();
        } catch (IOException e) {
            warn("Cannot launch {}: {}", argv.get(0), e.getMessage());
            return EXIT_NOT_FOUND;
        }
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SupervisionException("Interrupted while waiting for pid " + process.pid(), e);
        }
    }

    // ========================================================================
    // Monitors
    // ========================================================================

    private Optional<Monitor> startDstat(RunKey key) {
        Optional<Path> dstat = Executables.resolve(config.dstatTool());
        if (dstat.isEmpty()) {
            debug("{} not found, no dstat log for {}", config.dstatTool(), key);
            return Optional.empty();
        }
        Path output = layout.dstatLog(key);
        Optional<Monitor> monitor = Result.of(() -> {
                    // dstat appends to an existing --output file
                    Files.deleteIfExists(output);
                    Process p = new ProcessBuilder(
                            dstat.get().toString(), "--time", "--cpu", "--mem", "--io", "--net",
                            "--output", output.toString(), Long.toString(config.intervalSeconds()))
                            .redirectOutput(Redirect.DISCARD)
                            .redirectError(Redirect.DISCARD)
                            .start();
                    return new Monitor("dstat", p, output);
                })
                .onFailure(e -> warn("Cannot start dstat for {}: {}", key, e.getMessage()))
                .toOptional();
        if (monitor.isPresent() && !config.dstatWarmup().isZero()) {
            Result.sleep(config.dstatWarmup());
        }
        return monitor;
    }

    private List<Monitor> startSar(RunKey key) {
        Optional<Path> sar = Executables.resolve(config.sarTool());
        if (sar.isEmpty()) {
            debug("{} not found, no sar reports for {}", config.sarTool(), key);
            return List.of();
        }
        SarReportReader.Reports reports = layout.sarReports(key);
        List<Monitor> started = new ArrayList<>(4);
        startSar(sar.get(), "sar-cpu", reports.cpu(), List.of("-u")).ifPresent(started::add);
        startSar(sar.get(), "sar-mem", reports.memory(), List.of("-r")).ifPresent(started::add);
        startSar(sar.get(), "sar-dsk", reports.disk(), List.of("-b")).ifPresent(started::add);
        startSar(sar.get(), "sar-net", reports.network(), List.of("-n", "DEV")).ifPresent(started::add);
        return started;
    }

    private Optional<Monitor> startSar(Path sar, String name, Path output, List<String> report) {
        List<String> argv = new ArrayList<>();
        argv.add(sar.toString());
        argv.addAll(report);
        argv.add(Long.toString(config.intervalSeconds()));
        return Result.of(() -> {
                    ProcessBuilder builder = new ProcessBuilder(argv)
                            .redirectOutput(output.toFile())
                            .redirectError(Redirect.DISCARD);
                    // Fixed headers and decimal points regardless of the host locale
                    builder.environment().put("LC_ALL", "C");
                    return new Monitor(name, builder.start(), output);
                })
                .onFailure(e -> warn("Cannot start {}: {}", name, e.getMessage()))
                .toOptional();
    }

    private void stopAll(List<Monitor> monitors) {
        boolean dstatRunning = monitors.stream()
                .anyMatch(m -> m.name().equals("dstat") && m.process().isAlive());
        if (dstatRunning && !config.dstatGrace().isZero()) {
            // one more sample after the command exits
            Result.sleep(config.dstatGrace());
        }
        for (Monitor m : monitors) {
            stop(m);
        }
    }

    private void stop(Monitor m) {
        Process p = m.process();
        if (!p.isAlive()) {
            debug("{} already exited with {}", m.name(), p.exitValue());
            return;
        }
        signalInterrupt(p);
        if (exited(p, config.stopTimeout())) {
            return;
        }
        debug("{} ignored SIGINT, terminating", m.name());
        p.destroy();
        if (!exited(p, config.stopTimeout())) {
            p.destroyForcibly();
        }
    }

    private void signalInterrupt(Process p) {
        Result.of(() -> new ProcessBuilder("kill", "-INT", Long.toString(p.pid()))
                        .redirectOutput(Redirect.DISCARD)
                        .redirectError(Redirect.DISCARD)
                        .start()
                        .waitFor(config.stopTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .onFailure(e -> debug("Cannot send SIGINT to pid {}: {}", p.pid(), e.getMessage()));
    }

    private static boolean exited(Process p, Duration timeout) {
        try {
            return p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
