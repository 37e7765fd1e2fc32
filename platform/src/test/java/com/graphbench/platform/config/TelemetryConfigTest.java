package com.graphbench.platform.config;

import com.graphbench.platform.config.TelemetryConfig.UnparsableDuration;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TelemetryConfigTest {

    private final TelemetryConfig config = TelemetryConfig.from(ConfigFactory.empty())
            .withDataRoot(Path.of("/tmp/bench"));

    @Test
    void referenceDefaults() {
        assertEquals(Duration.ofSeconds(1), config.sampler().interval());
        assertEquals(UnparsableDuration.ABSENT, config.parse().unparsableDuration());
        assertTrue(config.parse().zeroThroughputAsAbsent());
        assertFalse(config.aggregate().includeSampledRuns());
        assertEquals("run", config.aggregate().sampledPhase());
    }

    @Test
    void frameworkPhases() {
        assertEquals(List.of("job"), config.frameworks().get("spark"));
        assertEquals(List.of("indegree", "distribution"), config.frameworks().get("hadoop"));
    }

    @Test
    void pathsDeriveFromDataRoot() {
        assertEquals(Path.of("/tmp/bench/metrics"), config.paths().metricsRoot());
        assertEquals(Path.of("/tmp/bench/metrics/summary.csv"), config.paths().summaryFile());
        assertEquals(Path.of("/tmp/bench/metrics/summary.alt.csv"), config.paths().fallbackSummaryFile());
        assertEquals(Path.of("/tmp/bench/results/metrics"), config.sampler().outRoot());

        TelemetryConfig moved = config.withDataRoot(Path.of("/srv/data"));
        assertEquals(Path.of("/srv/data/metrics/summary.csv"), moved.paths().summaryFile());
        assertEquals(Path.of("/tmp/bench/metrics/summary.csv"), config.paths().summaryFile());
    }

    @Test
    void intervalIsFlooredAtMinimum() {
        assertEquals(Duration.ofMillis(200), config.with("sampler.interval", "50ms").sampler().effectiveInterval());
        assertEquals(Duration.ofMillis(500), config.with("sampler.interval", "500ms").sampler().effectiveInterval());
    }

    @Test
    void configuredMinimumCannotLowerTheFloor() {
        TelemetryConfig unbounded = config
                .with("sampler.min-interval", "0ms")
                .with("sampler.interval", "10ms");
        assertEquals(Duration.ofMillis(200), unbounded.sampler().effectiveInterval());

        TelemetryConfig raised = config
                .with("sampler.min-interval", "750ms")
                .with("sampler.interval", "500ms");
        assertEquals(Duration.ofMillis(750), raised.sampler().effectiveInterval());
    }

    @Test
    void overridesFromApplicationConfig() {
        TelemetryConfig custom = TelemetryConfig.from(ConfigFactory.parseString("""
                telemetry {
                  data-root = "/x"
                  parse.unparsable-duration = zero
                  aggregate.parallelism = 0
                  frameworks.flink.phases = [etl]
                }
                """));

        assertEquals(UnparsableDuration.ZERO, custom.parse().unparsableDuration());
        assertEquals(1, custom.aggregate().parallelism());
        assertEquals(List.of("etl"), custom.frameworks().get("flink"));
        assertEquals(List.of("job"), custom.frameworks().get("spark"));
    }
}
