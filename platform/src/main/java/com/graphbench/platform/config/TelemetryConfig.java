package com.graphbench.platform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static com.graphbench.platform.config.ConfigAccessor.*;

/**
 * Type-safe access to telemetry configuration.
 *
 * Built once at startup and passed to every component that needs a root path.
 * There is no shared instance: two configs with different data roots can live
 * side by side (tests do this).
 *
 * Example:
 * <pre>
 *   var config = TelemetryConfig.load();
 *   Path table = config.paths().summaryFile();
 *   Duration every = config.sampler().effectiveInterval();
 * </pre>
 */
public final class TelemetryConfig {

    private static final String ROOT = "telemetry";

    private final Config config;
    private final PathsConfig paths;
    private final SamplerConfig sampler;
    private final ParseConfig parse;
    private final AggregateConfig aggregate;
    private final CaptureConfig capture;
    private final Map<String, List<String>> frameworks;

    /**
     * How the tool-report reader treats an elapsed value it cannot parse.
     */
    public enum UnparsableDuration {
        /** Report 0.0 seconds, as GNU-time post-processing scripts traditionally did. */
        ZERO,
        /** Report no value. */
        ABSENT
    }

    private TelemetryConfig(Config config) {
        this.config = config;
        this.paths = PathsConfig.from(config);
        this.sampler = SamplerConfig.from(config, paths.dataRoot());
        this.parse = ParseConfig.from(config);
        this.aggregate = AggregateConfig.from(config);
        this.capture = CaptureConfig.from(config);
        this.frameworks = frameworkPhases(config);
    }

    /**
     * Load from application.conf / reference.conf / system properties / DATA_ROOT.
     */
    public static TelemetryConfig load() {
        return from(ConfigFactory.load());
    }

    /**
     * Build from an already-loaded root config. Missing keys fall back to reference.conf.
     */
    public static TelemetryConfig from(Config root) {
        Config resolved = root.withFallback(ConfigFactory.defaultReference()).resolve();
        return new TelemetryConfig(resolved.getConfig(ROOT));
    }

    /**
     * Copy with a different data root. Paths derived from it are re-resolved.
     */
    public TelemetryConfig withDataRoot(Path dataRoot) {
        return new TelemetryConfig(config.withValue("data-root",
            ConfigValueFactory.fromAnyRef(dataRoot.toString())));
    }

    /**
     * Copy with a different value at {@code path} (relative to the telemetry root).
     */
    public TelemetryConfig with(String path, Object value) {
        return new TelemetryConfig(config.withValue(path, ConfigValueFactory.fromAnyRef(value)));
    }

    public PathsConfig paths()         { return paths; }
    public SamplerConfig sampler()     { return sampler; }
    public ParseConfig parse()         { return parse; }
    public AggregateConfig aggregate() { return aggregate; }
    public CaptureConfig capture()     { return capture; }

    /**
     * Configured phases per framework, ordered by framework name.
     */
    public Map<String, List<String>> frameworks() { return frameworks; }

    public Config raw() { return config; }

    private static Map<String, List<String>> frameworkPhases(Config c) {
        Map<String, List<String>> phases = new TreeMap<>();
        nested(c, "frameworks").ifPresent(fw -> {
            for (String name : fw.root().keySet()) {
                phases.put(name, List.copyOf(stringList(fw, name + ".phases", List.of())));
            }
        });
        return Collections.unmodifiableMap(phases);
    }

    // =========================================================================
    // Record: PathsConfig
    // =========================================================================

    public record PathsConfig(
        Path dataRoot,
        Path metricsRoot,
        Path summaryFile,
        Path fallbackSummaryFile,
        Path comparisonFile
    ) {
        public static PathsConfig from(Config c) {
            Path dataRoot = Path.of(string(c, "data-root", "/data"));
            Path metricsRoot = dataRoot.resolve(string(c, "metrics-dir", "metrics"));
            return new PathsConfig(
                dataRoot,
                metricsRoot,
                metricsRoot.resolve(string(c, "summary-file", "summary.csv")),
                metricsRoot.resolve(string(c, "fallback-summary-file", "summary.alt.csv")),
                metricsRoot.resolve(string(c, "comparison-file", "comparison.json"))
            );
        }
    }

    // =========================================================================
    // Record: SamplerConfig
    // =========================================================================

    public record SamplerConfig(
        Duration interval,
        Duration minInterval,
        Path outRoot
    ) {
        public static SamplerConfig from(Config c, Path dataRoot) {
            return new SamplerConfig(
                duration(c, "sampler.interval", Duration.ofSeconds(1)),
                duration(c, "sampler.min-interval", Duration.ofMillis(200)),
                dataRoot.resolve(string(c, "sampler.out-root", "results/metrics"))
            );
        }

        /** Hard lower bound; {@code min-interval} can raise it but never lower it. */
        public static final Duration FLOOR = Duration.ofMillis(200);

        /**
         * Configured interval, never below {@code min-interval} or {@link #FLOOR}.
         */
        public Duration effectiveInterval() {
            Duration floor = minInterval.compareTo(FLOOR) < 0 ? FLOOR : minInterval;
            return interval.compareTo(floor) < 0 ? floor : interval;
        }
    }

    // =========================================================================
    // Record: ParseConfig
    // =========================================================================

    public record ParseConfig(
        UnparsableDuration unparsableDuration,
        boolean zeroThroughputAsAbsent
    ) {
        public static ParseConfig from(Config c) {
            return new ParseConfig(
                UnparsableDuration.valueOf(
                    string(c, "parse.unparsable-duration", "absent").trim().toUpperCase(Locale.ROOT)),
                bool(c, "parse.zero-throughput-as-absent", true)
            );
        }

        public static ParseConfig defaults() {
            return new ParseConfig(UnparsableDuration.ABSENT, true);
        }
    }

    // =========================================================================
    // Record: AggregateConfig
    // =========================================================================

    public record AggregateConfig(
        int parallelism,
        boolean includeSampledRuns,
        String sampledPhase
    ) {
        public static AggregateConfig from(Config c) {
            return new AggregateConfig(
                Math.max(1, intVal(c, "aggregate.parallelism", 4)),
                bool(c, "aggregate.include-sampled-runs", false),
                string(c, "aggregate.sampled-phase", "run")
            );
        }
    }

    // =========================================================================
    // Record: CaptureConfig
    // =========================================================================

    /**
     * External profilers run around a captured command. A tool that cannot be found is skipped.
     */
    public record CaptureConfig(
        String timeTool,
        String dstatTool,
        String sarTool,
        Duration interval,
        Duration dstatWarmup,
        Duration dstatGrace,
        Duration stopTimeout
    ) {
        public static CaptureConfig from(Config c) {
            return new CaptureConfig(
                string(c, "capture.time", "/usr/bin/time"),
                string(c, "capture.dstat", "dstat"),
                string(c, "capture.sar", "sar"),
                duration(c, "capture.interval", Duration.ofSeconds(1)),
                duration(c, "capture.dstat-warmup", Duration.ofSeconds(2)),
                duration(c, "capture.dstat-grace", Duration.ofSeconds(1)),
                duration(c, "capture.stop-timeout", Duration.ofSeconds(5))
            );
        }

        /**
         * Monitor interval in whole seconds, as dstat and sar take it.
         */
        public long intervalSeconds() {
            return Math.max(1L, interval.toSeconds());
        }
    }
}
