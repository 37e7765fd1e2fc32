package com.graphbench.telemetry.aggregate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphbench.platform.base.Result;
import com.graphbench.telemetry.model.DstatAverages;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.ParsedToolMetrics;
import com.graphbench.telemetry.model.RunKey;
import com.graphbench.telemetry.model.RunSummary;
import com.graphbench.telemetry.sampler.ProcessSupervisor;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.stream.Stream;

import static com.graphbench.platform.observe.Log.*;

/**
 * Turns supervised runs ({@code summary.json} + {@code timeseries.csv}) into metrics records.
 *
 * Averages come from the time series: CPU and memory are sample means, throughput is the
 * summary's byte delta over elapsed time in KB/s. No tool-report fields are available, so
 * only elapsed time is filled on that side.
 */
public final class SampledRunReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path outRoot;
    private final String phase;

    public SampledRunReader(Path outRoot, String phase) {
        this.outRoot = outRoot;
        this.phase = phase;
    }

    /**
     * Every run under {@code {outRoot}/{system}/{dataset}} that has a summary.
     */
    public List<MetricsRecord> readAll() {
        List<MetricsRecord> records = new ArrayList<>();
        for (Path systemDir : directories(outRoot)) {
            for (Path datasetDir : directories(systemDir)) {
                read(datasetDir).ifPresent(records::add);
            }
        }
        return records;
    }

    /**
     * The run in {@code runDir}, or empty when it has no readable summary.
     */
    public Optional<MetricsRecord> read(Path runDir) {
        Path summaryFile = runDir.resolve(ProcessSupervisor.SUMMARY_FILE);
        if (!Files.isRegularFile(summaryFile)) {
            return Optional.empty();
        }
        return Result.of(() -> mapper.readValue(summaryFile.toFile(), RunSummary.class))
                .flatMap(summary -> labelled(summary, summaryFile))
                .map(summary -> toRecord(summary, runDir.resolve(ProcessSupervisor.TIMESERIES_FILE)))
                .onFailure(e -> warn("Skipping run summary {}: {}", summaryFile, e.getMessage()))
                .toOptional();
    }

    private static Result<RunSummary> labelled(RunSummary summary, Path summaryFile) {
        if (isBlank(summary.system()) || isBlank(summary.dataset())) {
            return Result.failure("no system or dataset label in " + summaryFile.getFileName());
        }
        return Result.success(summary);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private MetricsRecord toRecord(RunSummary summary, Path timeseries) {
        RunKey key = new RunKey(summary.system(), summary.dataset(), phase);
        double elapsed = summary.elapsedSec();
        ParsedToolMetrics tool = new ParsedToolMetrics(
                OptionalDouble.of(elapsed),
                OptionalDouble.empty(),
                OptionalDouble.empty(),
                OptionalLong.empty()
        );
        Means means = means(timeseries);
        DstatAverages averages = new DstatAverages(
                means.cpu(),
                means.memory(),
                kbps(summary.diskReadDeltaBytes(), elapsed),
                kbps(summary.diskWriteDeltaBytes(), elapsed),
                kbps(summary.netRecvDeltaBytes(), elapsed),
                kbps(summary.netSentDeltaBytes(), elapsed)
        );
        debug("Read sampled run {} ({} samples)", key, summary.samples());
        return new MetricsRecord(key, tool, averages);
    }

    private record Means(OptionalDouble cpu, OptionalDouble memory) {}

    private static Means means(Path timeseries) {
        if (!Files.isRegularFile(timeseries)) {
            return new Means(OptionalDouble.empty(), OptionalDouble.empty());
        }
        return Result.of(() -> {
                    List<Double> cpu = new ArrayList<>();
                    List<Double> memory = new ArrayList<>();
                    try (Reader in = Files.newBufferedReader(timeseries, StandardCharsets.UTF_8);
                         CSVParser parser = CSVParser.parse(in, FORMAT)) {
                        for (CSVRecord row : parser) {
                            value(row, "cpu_percent").ifPresent(cpu::add);
                            value(row, "mem_used_mb").ifPresent(memory::add);
                        }
                    }
                    return new Means(mean(cpu), mean(memory));
                })
                .onFailure(e -> warn("Cannot read {}: {}", timeseries, e.getMessage()))
                .getOrElse(new Means(OptionalDouble.empty(), OptionalDouble.empty()));
    }

    private static Optional<Double> value(CSVRecord row, String column) {
        if (!row.isMapped(column) || !row.isSet(column)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(row.get(column).trim()));
        } catch (NumberFormatException e) {
            debug("Skipping {} cell in row {}", column, row.getRecordNumber());
            return Optional.empty();
        }
    }

    private static OptionalDouble mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average();
    }

    private static OptionalDouble kbps(long deltaBytes, double elapsedSec) {
        if (elapsedSec <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(deltaBytes / elapsedSec / 1024.0);
    }

    private static List<Path> directories(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            warn("Cannot list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }
}
