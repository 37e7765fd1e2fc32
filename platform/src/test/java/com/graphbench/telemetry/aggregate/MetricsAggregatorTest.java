package com.graphbench.telemetry.aggregate;

import com.graphbench.platform.config.TelemetryConfig;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.RunKey;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NavigableMap;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsAggregatorTest {

    @TempDir
    Path dataRoot;

    private TelemetryConfig config;
    private Path metrics;

    @BeforeEach
    void setUp() throws Exception {
        config = TelemetryConfig.from(ConfigFactory.empty()).withDataRoot(dataRoot);
        metrics = config.paths().metricsRoot();

        Path spark = Files.createDirectories(metrics.resolve("spark/email-EuAll"));
        Files.write(spark.resolve("job.time"), List.of(
                "\tUser time (seconds): 40.10",
                "\tSystem time (seconds): 3.20",
                "\tElapsed (wall clock) time (h:mm:ss or m:ss): 1:05.50",
                "\tMaximum resident set size (kbytes): 512000"
        ));
        Files.write(spark.resolve("job.dstat.csv"), List.of(
                "\"time\",\"usr\",\"sys\",\"idl\",\"used\",\"read\",\"writ\",\"recv\",\"send\"",
                "t1,10,5,80,1048576,10,20,30,40",
                "t2,10,5,60,1048576,30,20,10,0"
        ));

        Path hadoop = Files.createDirectories(metrics.resolve("hadoop/email-EuAll"));
        Files.write(hadoop.resolve("indegree.time"), List.of("elapsed_seconds: 80"));
        Files.write(hadoop.resolve("indegree.sar.cpu.txt"), List.of(
                "Average:        all      4.00      0.00      2.00      0.00      0.00     94.00"));
        Files.write(hadoop.resolve("distribution.time"), List.of("elapsed_seconds: 20.5"));
    }

    @Test
    void producesOneRowPerConfiguredPhaseInKeyOrder() {
        NavigableMap<RunKey, MetricsRecord> records = MetricsAggregator.create(config).collect();

        assertEquals(List.of(
                new RunKey("hadoop", "email-EuAll", "distribution"),
                new RunKey("hadoop", "email-EuAll", "indegree"),
                new RunKey("spark", "email-EuAll", "job")
        ), List.copyOf(records.keySet()));
    }

    @Test
    void joinsToolReportAndDstatAverages() {
        MetricsRecord spark = MetricsAggregator.create(config).collect()
                .get(new RunKey("spark", "email-EuAll", "job"));

        assertEquals(65.5, spark.tool().elapsedSeconds().getAsDouble(), 1e-9);
        assertEquals(512000L, spark.tool().maxRssKb().getAsLong());
        assertEquals(30.0, spark.averages().avgCpuUtil().getAsDouble(), 1e-9);
        assertEquals(1.0, spark.averages().avgMemUsedMb().getAsDouble(), 1e-9);
        assertEquals(20.0, spark.averages().avgDskReadKbps().getAsDouble(), 1e-9);
        assertEquals(20.0, spark.averages().avgNetSendKbps().getAsDouble(), 1e-9);
    }

    @Test
    void fallsBackToSarWhenDstatHasNothing() {
        MetricsRecord indegree = MetricsAggregator.create(config).collect()
                .get(new RunKey("hadoop", "email-EuAll", "indegree"));

        assertEquals(80.0, indegree.tool().elapsedSeconds().getAsDouble(), 1e-9);
        assertEquals(6.0, indegree.averages().avgCpuUtil().getAsDouble(), 1e-9);
        assertTrue(indegree.averages().avgMemUsedMb().isEmpty());
    }

    @Test
    void missingProfilerOutputGivesAbsentFields() {
        MetricsRecord distribution = MetricsAggregator.create(config).collect()
                .get(new RunKey("hadoop", "email-EuAll", "distribution"));

        assertEquals(20.5, distribution.tool().elapsedSeconds().getAsDouble(), 1e-9);
        assertTrue(distribution.tool().userCpuSeconds().isEmpty());
        assertTrue(distribution.averages().isEmpty());
    }

    @Test
    void unconfiguredFrameworkUsesTimedPhases() throws Exception {
        Path flink = Files.createDirectories(metrics.resolve("flink/web-Google"));
        Files.write(flink.resolve("etl.time"), List.of("real 12.00"));
        Files.write(flink.resolve("notes.txt"), List.of("ignored"));

        NavigableMap<RunKey, MetricsRecord> records = MetricsAggregator.create(config).collect();

        assertTrue(records.containsKey(new RunKey("flink", "web-Google", "etl")));
        assertEquals(4, records.size());
    }

    @Test
    void writesTableWithFixedColumns() throws Exception {
        TableWriteResult written = MetricsAggregator.create(config).run().getOrThrow();

        assertFalse(written.usedFallback());
        assertEquals(config.paths().summaryFile(), written.path());
        assertEquals(3, written.rows());

        List<String> lines = Files.readAllLines(written.path());
        assertEquals(String.join(",", SummaryTable.COLUMNS), lines.get(0));
        assertEquals("hadoop,email-EuAll,distribution,20.5,,,,,,,,,", lines.get(1));
        assertTrue(lines.get(3).startsWith("spark,email-EuAll,job,65.5,512000,40.1,3.2,30.0,"), lines.get(3));
    }

    @Test
    void rerunOverSameInputIsByteIdentical() throws Exception {
        MetricsAggregator aggregator = MetricsAggregator.create(config);

        byte[] first = Files.readAllBytes(aggregator.run().getOrThrow().path());
        byte[] second = Files.readAllBytes(aggregator.run().getOrThrow().path());

        assertArrayEquals(first, second);
    }

    @Test
    void unwritableDestinationUsesFallback() throws Exception {
        // A non-empty directory where the table should go cannot be replaced.
        Path blocked = Files.createDirectories(config.paths().summaryFile());
        Files.writeString(blocked.resolve("keep"), "x");

        TableWriteResult written = MetricsAggregator.create(config).run().getOrThrow();

        assertTrue(written.usedFallback());
        assertEquals(config.paths().fallbackSummaryFile(), written.path());
        assertTrue(Files.isRegularFile(written.path()));
        assertTrue(Files.isDirectory(blocked));
    }

    @Test
    void includesSampledRunsWhenEnabled() throws Exception {
        Path run = Files.createDirectories(config.sampler().outRoot().resolve("spark/web-Google"));
        Files.writeString(run.resolve("summary.json"), """
                {"system": "spark", "dataset": "web-Google", "start_epoch": 1.0, "end_epoch": 11.0,
                 "elapsed_sec": 10.0, "peak_cpu_percent": 50.0, "max_mem_used_mb": 100.0,
                 "disk_read_delta_bytes": 0, "disk_write_delta_bytes": 0,
                 "net_sent_delta_bytes": 0, "net_recv_delta_bytes": 0, "samples": 1, "cmd": ["true"]}
                """);

        assertFalse(MetricsAggregator.create(config).collect()
                .containsKey(new RunKey("spark", "web-Google", "run")));

        TelemetryConfig enabled = config.with("aggregate.include-sampled-runs", true);
        MetricsRecord sampled = MetricsAggregator.create(enabled).collect()
                .get(new RunKey("spark", "web-Google", "run"));

        assertNotNull(sampled);
        assertEquals(10.0, sampled.tool().elapsedSeconds().getAsDouble(), 1e-9);
    }

    @Test
    void unlabelledSampledRunDoesNotStopTheTable() throws Exception {
        Path run = Files.createDirectories(config.sampler().outRoot().resolve("spark/ds"));
        Files.writeString(run.resolve("summary.json"), "{\"elapsed_sec\": 3.0}");

        TableWriteResult written = MetricsAggregator.create(config.with("aggregate.include-sampled-runs", true))
                .run()
                .getOrThrow();

        assertFalse(written.usedFallback());
        assertEquals(3, written.rows());
    }
}
