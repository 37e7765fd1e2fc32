package com.graphbench.telemetry.cli;

import com.graphbench.platform.config.TelemetryConfig;
import com.graphbench.telemetry.aggregate.MetricsAggregator;
import com.graphbench.telemetry.aggregate.RunLayout;
import com.graphbench.telemetry.aggregate.SummaryLocator;
import com.graphbench.telemetry.aggregate.SummaryTable;
import com.graphbench.telemetry.aggregate.TableWriteResult;
import com.graphbench.telemetry.capture.CaptureResult;
import com.graphbench.telemetry.capture.ToolCapture;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.RunKey;
import com.graphbench.telemetry.model.RunSummary;
import com.graphbench.telemetry.report.ComparisonReportGenerator;
import com.graphbench.telemetry.report.ComparisonTypes.ComparisonReport;
import com.graphbench.telemetry.sampler.ProcessSupervisor;
import com.graphbench.telemetry.sampler.SupervisionException;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.graphbench.platform.observe.Log.*;

/**
 * CLI for capturing and aggregating run telemetry.
 *
 * Usage:
 *   java -jar telemetry-platform.jar <command> [options]
 *
 * Commands: capture, sample, aggregate, compare
 *
 * Exit codes: {@code capture} and {@code sample} return the child's exit code ({@code capture}
 * reports 127 for a command that cannot be launched); 1 when {@code sample} cannot launch the
 * command or a report cannot be written; 2 on a usage error.
 */
public class TelemetryCli {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String LOG_LEVEL_PROPERTY = "TELEMETRY_LOG_LEVEL";

    private final PrintStream out;
    private final PrintStream err;

    TelemetryCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new TelemetryCli(System.out, System.err).run(args));
    }

    /**
     * Run one command against the configuration on the classpath.
     */
    public int run(String[] args) {
        return run(args, TelemetryConfig.load());
    }

    int run(String[] args, TelemetryConfig config) {
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        int separator = rest.indexOf("--");
        List<String> options = separator >= 0 ? rest.subList(0, separator) : rest;
        boolean debugging = options.remove("--debug");
        if (debugging) {
            // Must happen before the first logger is created.
            System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
            enableInvestigation();
        }
        try {
            return dispatch(rest, config);
        } finally {
            if (debugging) {
                disableInvestigation();
            }
        }
    }

    private int dispatch(List<String> rest, TelemetryConfig config) {
        if (rest.isEmpty()) {
            printUsage(err);
            return EXIT_USAGE;
        }

        String command = rest.get(0);
        List<String> tail = rest.subList(1, rest.size());
        try {
            return switch (command) {
                case "capture" -> capture(tail, config);
                case "sample" -> sample(tail, config);
                case "aggregate" -> aggregate(tail, config);
                case "compare" -> compare(tail, config);
                case "--help", "-h", "help" -> {
                    printUsage(out);
                    yield 0;
                }
                default -> usageError("Unknown command: " + command);
            };
        } catch (UsageException e) {
            return usageError(e.getMessage());
        }
    }

    // ========================================================================
    // capture
    // ========================================================================

    private int capture(List<String> args, TelemetryConfig config) {
        String framework = null;
        String dataset = null;
        String phase = null;
        List<String> cmd = List.of();

        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--framework" -> framework = value(args, ++i, "--framework");
                case "--dataset" -> dataset = value(args, ++i, "--dataset");
                case "--phase" -> phase = value(args, ++i, "--phase");
                case "--data-root" -> config = config.withDataRoot(Path.of(value(args, ++i, "--data-root")));
                case "--" -> {
                    cmd = List.copyOf(args.subList(i + 1, args.size()));
                    i = args.size();
                }
                default -> throw new UsageException("Unknown option: " + args.get(i));
            }
        }
        if (framework == null || dataset == null || phase == null) {
            throw new UsageException("capture requires --framework, --dataset and --phase");
        }
        if (cmd.isEmpty()) {
            throw new UsageException("Missing command after --");
        }

        RunLayout layout = new RunLayout(config.paths().metricsRoot(), config.frameworks());
        try {
            CaptureResult result = ToolCapture.create(config.capture(), layout)
                    .capture(new RunKey(framework, dataset, phase), cmd);
            out.printf("Captured %s: exit code %d, %d monitor log(s)%n",
                    result.key(), result.exitCode(), result.monitors().size());
            out.printf("Metrics written to %s%n", layout.runDirectory(result.key()));
            return result.exitCode();
        } catch (SupervisionException e) {
            error("Capture failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    // ========================================================================
    // sample
    // ========================================================================

    private int sample(List<String> args, TelemetryConfig config) {
        String system = null;
        String dataset = null;
        List<String> cmd = List.of();

        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--system" -> system = value(args, ++i, "--system");
                case "--dataset" -> dataset = value(args, ++i, "--dataset");
                case "--out-root" -> config = config.with("sampler.out-root",
                        Path.of(value(args, ++i, "--out-root")).toAbsolutePath().toString());
                case "--interval" -> config = config.with("sampler.interval",
                        Math.round(seconds(value(args, ++i, "--interval")) * 1000) + "ms");
                case "--data-root" -> config = config.withDataRoot(Path.of(value(args, ++i, "--data-root")));
                case "--" -> {
                    cmd = List.copyOf(args.subList(i + 1, args.size()));
                    i = args.size();
                }
                default -> throw new UsageException("Unknown option: " + args.get(i));
            }
        }
        if (system == null || dataset == null) {
            throw new UsageException("sample requires --system and --dataset");
        }
        if (cmd.isEmpty()) {
            throw new UsageException("Missing command after --");
        }

        ProcessSupervisor supervisor = ProcessSupervisor.create(config.sampler());
        try {
            RunSummary summary = supervisor.supervise(system, dataset, cmd);
            out.printf(Locale.ROOT, "Run finished: %.3f s, %d samples, exit code %d%n",
                    summary.elapsedSec(), summary.samples(), summary.exitCode());
            out.printf("Metrics written to %s%n", supervisor.runDirectory(system, dataset));
            return summary.exitCode();
        } catch (SupervisionException e) {
            error("Supervision failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    // ========================================================================
    // aggregate
    // ========================================================================

    private int aggregate(List<String> args, TelemetryConfig config) {
        config = dataRootOption(args, config);
        TelemetryConfig effective = config;
        return MetricsAggregator.create(effective).run()
                .fold(e -> {
                    error("Cannot write summary table", e);
                    err.println("Error: could not write " + effective.paths().summaryFile()
                            + " or " + effective.paths().fallbackSummaryFile());
                    return EXIT_FAILURE;
                }, written -> {
                    printWritten(written, effective);
                    return 0;
                });
    }

    private void printWritten(TableWriteResult written, TelemetryConfig config) {
        if (written.usedFallback()) {
            out.printf("Could not write %s. Wrote fallback %s%n", config.paths().summaryFile(), written.path());
        } else {
            out.printf("Wrote %s%n", written.path());
        }
    }

    // ========================================================================
    // compare
    // ========================================================================

    private int compare(List<String> args, TelemetryConfig config) {
        config = dataRootOption(args, config);
        Path metricsRoot = config.paths().metricsRoot();
        Optional<Path> table = SummaryLocator.newest(metricsRoot);
        if (table.isEmpty()) {
            err.println("No summary table in " + metricsRoot + "; run 'aggregate' first");
            return EXIT_FAILURE;
        }

        List<MetricsRecord> rows = SummaryTable.read(table.get());
        ComparisonReport report = ComparisonReport.of(table.get(), ComparisonReportGenerator.compare(rows));
        out.print(ComparisonReportGenerator.render(report));

        return ComparisonReportGenerator.create(config.paths().comparisonFile())
                .generate(report)
                .fold(e -> {
                    error("Cannot write comparison report", e);
                    return EXIT_FAILURE;
                }, path -> {
                    out.printf("Report generated: %s%n", path);
                    return 0;
                });
    }

    // ========================================================================
    // Options
    // ========================================================================

    private static TelemetryConfig dataRootOption(List<String> args, TelemetryConfig config) {
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).equals("--data-root")) {
                config = config.withDataRoot(Path.of(value(args, ++i, "--data-root")));
            } else {
                throw new UsageException("Unknown option: " + args.get(i));
            }
        }
        return config;
    }

    private static String value(List<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new UsageException(option + " requires a value");
        }
        return args.get(index);
    }

    private static double seconds(String text) {
        try {
            double s = Double.parseDouble(text);
            if (s <= 0 || Double.isNaN(s) || Double.isInfinite(s)) {
                throw new UsageException("--interval must be a positive number of seconds");
            }
            return s;
        } catch (NumberFormatException e) {
            throw new UsageException("--interval must be a number of seconds, got '" + text + "'");
        }
    }

    private int usageError(String message) {
        err.println(message);
        printUsage(err);
        return EXIT_USAGE;
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("""
            Usage: telemetry [--debug] <command> [options]

            Commands:
              capture     Run one phase under GNU time, dstat and sar for 'aggregate'
              sample      Run a command and record host metrics while it runs
              aggregate   Build the summary table from profiler output
              compare     Compare frameworks per dataset from the newest summary table

            capture options:
              --framework <name>    Framework label, e.g. spark or hadoop (required)
              --dataset <name>      Dataset label (required)
              --phase <name>        Phase label, e.g. job or indegree (required)
              --data-root <dir>     Data root containing metrics/ (default: $DATA_ROOT or /data)
              -- <command...>       The command to run

            sample options:
              --system <name>       System label, e.g. spark or hadoop (required)
              --dataset <name>      Dataset label (required)
              --out-root <dir>      Output root (default: <data-root>/results/metrics)
              --interval <seconds>  Sampling interval (default: 1, minimum 0.2)
              --data-root <dir>     Data root (default: $DATA_ROOT or /data)
              -- <command...>       The command to supervise

            aggregate / compare options:
              --data-root <dir>     Data root containing metrics/ (default: $DATA_ROOT or /data)

            Global:
              --debug               Debug logging and tracing spans
              --help, -h            Show this help

            Examples:
              telemetry capture --framework hadoop --dataset email-EuAll --phase indegree -- hadoop jar degree.jar
              telemetry sample --system spark --dataset email-EuAll -- spark-submit job.py
              telemetry aggregate --data-root ./data
              telemetry compare
            """);
    }
}
