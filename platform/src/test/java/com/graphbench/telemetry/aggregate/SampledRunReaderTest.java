package com.graphbench.telemetry.aggregate;

import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.RunKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SampledRunReaderTest {

    @TempDir
    Path outRoot;

    private Path run(String system, String dataset, String summaryJson, String... timeseries) throws Exception {
        Path dir = Files.createDirectories(outRoot.resolve(system).resolve(dataset));
        Files.writeString(dir.resolve("summary.json"), summaryJson);
        if (timeseries.length > 0) {
            Files.write(dir.resolve("timeseries.csv"), List.of(timeseries));
        }
        return dir;
    }

    @Test
    void derivesAveragesFromTimeSeriesAndDeltas() throws Exception {
        // Older summaries carry avg_cpu_percent and no exit_code.
        Path dir = run("spark", "email-EuAll", """
                {"system": "spark", "dataset": "email-EuAll", "start_epoch": 100.0, "end_epoch": 110.0,
                 "elapsed_sec": 10.0, "avg_cpu_percent": null, "peak_cpu_percent": 80.0, "max_mem_used_mb": 900.0,
                 "disk_read_delta_bytes": 10240, "disk_write_delta_bytes": 20480,
                 "net_sent_delta_bytes": 0, "net_recv_delta_bytes": 5120, "samples": 3, "cmd": ["spark-submit"]}
                """,
                "t_sec,cpu_percent,mem_used_mb,mem_percent,disk_read_bytes,disk_write_bytes,net_sent_bytes,net_recv_bytes",
                "0.000,0.00,800.00,10.00,0,0,0,0",
                "5.001,60.00,900.00,11.00,0,0,0,0",
                "10.002,30.00,1000.00,12.00,0,0,0,0");

        MetricsRecord r = new SampledRunReader(outRoot, "run").read(dir).orElseThrow();

        assertEquals(new RunKey("spark", "email-EuAll", "run"), r.key());
        assertEquals(10.0, r.tool().elapsedSeconds().getAsDouble(), 1e-9);
        assertTrue(r.tool().maxRssKb().isEmpty());
        assertEquals(30.0, r.averages().avgCpuUtil().getAsDouble(), 1e-9);
        assertEquals(900.0, r.averages().avgMemUsedMb().getAsDouble(), 1e-9);
        assertEquals(1.0, r.averages().avgDskReadKbps().getAsDouble(), 1e-9);
        assertEquals(2.0, r.averages().avgDskWritKbps().getAsDouble(), 1e-9);
        assertEquals(0.5, r.averages().avgNetRecvKbps().getAsDouble(), 1e-9);
        assertEquals(0.0, r.averages().avgNetSendKbps().getAsDouble(), 1e-9);
    }

    @Test
    void missingTimeSeriesLeavesMeansAbsent() throws Exception {
        Path dir = run("hadoop", "ds", """
                {"system": "hadoop", "dataset": "ds", "elapsed_sec": 0.0, "samples": 0, "cmd": []}
                """);

        MetricsRecord r = new SampledRunReader(outRoot, "run").read(dir).orElseThrow();

        assertTrue(r.averages().avgCpuUtil().isEmpty());
        assertTrue(r.averages().avgDskReadKbps().isEmpty(), "no rate over zero elapsed time");
    }

    @Test
    void readAllSkipsDirectoriesWithoutSummary() throws Exception {
        run("spark", "a", "{\"system\": \"spark\", \"dataset\": \"a\", \"elapsed_sec\": 1.0}");
        Files.createDirectories(outRoot.resolve("spark/b"));
        run("spark", "c", "not json");

        List<MetricsRecord> all = new SampledRunReader(outRoot, "run").readAll();

        assertEquals(1, all.size());
        assertEquals("a", all.get(0).dataset());
    }

    @Test
    void summaryWithoutLabelsIsSkipped() throws Exception {
        Path unlabelled = run("spark", "ds", "{\"elapsed_sec\": 3.0}");
        run("spark", "blank", "{\"system\": \" \", \"dataset\": \"blank\", \"elapsed_sec\": 1.0}");
        run("hadoop", "ok", "{\"system\": \"hadoop\", \"dataset\": \"ok\", \"elapsed_sec\": 2.0}");

        SampledRunReader reader = new SampledRunReader(outRoot, "run");

        assertTrue(reader.read(unlabelled).isEmpty());
        List<MetricsRecord> all = assertDoesNotThrow(() -> reader.readAll());
        assertEquals(1, all.size());
        assertEquals(new RunKey("hadoop", "ok", "run"), all.get(0).key());
    }
}
