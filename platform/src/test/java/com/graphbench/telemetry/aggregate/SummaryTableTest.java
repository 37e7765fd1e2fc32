package com.graphbench.telemetry.aggregate;

import com.graphbench.telemetry.model.DstatAverages;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.ParsedToolMetrics;
import com.graphbench.telemetry.model.RunKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class SummaryTableTest {

    @TempDir
    Path dir;

    private static MetricsRecord record(String framework, String phase, double elapsed) {
        return new MetricsRecord(new RunKey(framework, "ds", phase),
                new ParsedToolMetrics(OptionalDouble.of(elapsed), OptionalDouble.empty(),
                        OptionalDouble.empty(), OptionalLong.of(1024)),
                DstatAverages.empty());
    }

    @Test
    void numbersUsePlainDecimalForm() {
        assertEquals("", SummaryTable.cell(OptionalDouble.empty()));
        assertEquals("12.5", SummaryTable.cell(OptionalDouble.of(12.5)));
        assertEquals("10000000", SummaryTable.cell(OptionalDouble.of(1.0e7)));
        assertEquals("0.0001", SummaryTable.cell(OptionalDouble.of(1.0e-4)));
        assertEquals("", SummaryTable.cell(OptionalDouble.of(Double.NaN)));
    }

    @Test
    void rowsAreSortedRegardlessOfInputOrder() throws Exception {
        Path table = dir.resolve("summary.csv");

        SummaryTable.write(List.of(record("spark", "job", 1), record("hadoop", "indegree", 2),
                record("hadoop", "distribution", 3)), table, dir.resolve("summary.alt.csv")).getOrThrow();

        List<String> lines = Files.readAllLines(table);
        assertTrue(lines.get(1).startsWith("hadoop,ds,distribution,"));
        assertTrue(lines.get(2).startsWith("hadoop,ds,indegree,"));
        assertTrue(lines.get(3).startsWith("spark,ds,job,"));
    }

    @Test
    void replacesExistingTableWithoutLeavingTempFiles() throws Exception {
        Path table = dir.resolve("summary.csv");
        Files.writeString(table, "stale");

        SummaryTable.write(List.of(record("spark", "job", 1)), table, dir.resolve("summary.alt.csv")).getOrThrow();

        assertTrue(Files.readString(table).startsWith("framework,"));
        try (var entries = Files.list(dir)) {
            assertEquals(List.of(table), entries.toList());
        }
    }

    @Test
    void readsTablesFromOlderWriters() throws Exception {
        Path table = dir.resolve("summary.csv");
        Files.write(table, List.of(
                String.join(",", SummaryTable.COLUMNS),
                "spark,ds,job,65.5,512000.0,40.1,3.2,30.0,,,,,",
                ",,,1,,,,,,,,,",
                "hadoop,ds,indegree,oops,,,,,,,,,"
        ));

        List<MetricsRecord> rows = SummaryTable.read(table);

        assertEquals(2, rows.size());
        assertEquals(512000L, rows.get(0).tool().maxRssKb().getAsLong());
        assertEquals(30.0, rows.get(0).averages().avgCpuUtil().getAsDouble(), 1e-9);
        assertTrue(rows.get(0).averages().avgMemUsedMb().isEmpty());
        assertTrue(rows.get(1).tool().elapsedSeconds().isEmpty());
    }

    @Test
    void missingTableReadsAsNoRows() {
        assertTrue(SummaryTable.read(dir.resolve("nope.csv")).isEmpty());
    }
}
