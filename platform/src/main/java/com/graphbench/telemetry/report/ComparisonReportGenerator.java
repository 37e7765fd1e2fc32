package com.graphbench.telemetry.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.graphbench.platform.base.Result;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.report.ComparisonTypes.ComparisonReport;
import com.graphbench.telemetry.report.ComparisonTypes.DatasetComparison;
import com.graphbench.telemetry.report.ComparisonTypes.FrameworkTotals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.graphbench.platform.observe.Log.*;

/**
 * Compares frameworks per dataset from summary table rows and writes the result as JSON.
 *
 * Output:
 *   {metricsRoot}/comparison.json
 */
public class ComparisonReportGenerator {

    private static final ObjectMapper mapper = createMapper();

    private final Path outputFile;

    // ========================================================================
    // Static Factories
    // ========================================================================

    public static ComparisonReportGenerator create(Path outputFile) {
        return new ComparisonReportGenerator(outputFile);
    }

    private ComparisonReportGenerator(Path outputFile) {
        this.outputFile = outputFile;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return mapper;
    }

    static ObjectMapper mapper() {
        return mapper;
    }

    // ========================================================================
    // Comparison
    // ========================================================================

    /**
     * Group rows by dataset and framework, combine phases, and rank frameworks by elapsed time.
     */
    public static List<DatasetComparison> compare(List<MetricsRecord> rows) {
        Map<String, Map<String, List<MetricsRecord>>> byDataset = rows.stream()
                .collect(Collectors.groupingBy(MetricsRecord::dataset, TreeMap::new,
                        Collectors.groupingBy(MetricsRecord::framework, TreeMap::new, Collectors.toList())));

        List<DatasetComparison> result = new ArrayList<>();
        byDataset.forEach((dataset, frameworks) -> {
            List<FrameworkTotals> totals = frameworks.entrySet().stream()
                    .map(e -> combine(e.getKey(), dataset, e.getValue()))
                    .toList();
            result.add(rank(dataset, totals));
        });
        return result;
    }

    static FrameworkTotals combine(String framework, String dataset, List<MetricsRecord> phases) {
        return new FrameworkTotals(
                framework,
                dataset,
                phases.stream().map(MetricsRecord::phase).sorted().toList(),
                sum(phases, r -> r.tool().elapsedSeconds()),
                sum(phases, r -> r.tool().userCpuSeconds()),
                sum(phases, r -> r.tool().systemCpuSeconds()),
                phases.stream()
                        .map(r -> r.tool().maxRssKb())
                        .filter(OptionalLong::isPresent)
                        .mapToLong(OptionalLong::getAsLong)
                        .max(),
                mean(phases, r -> r.averages().avgCpuUtil()),
                mean(phases, r -> r.averages().avgMemUsedMb()),
                mean(phases, r -> r.averages().avgDskReadKbps()),
                mean(phases, r -> r.averages().avgDskWritKbps()),
                mean(phases, r -> r.averages().avgNetRecvKbps()),
                mean(phases, r -> r.averages().avgNetSendKbps())
        );
    }

    static DatasetComparison rank(String dataset, List<FrameworkTotals> totals) {
        List<FrameworkTotals> timed = totals.stream()
                .filter(t -> t.elapsedSeconds().isPresent())
                .sorted(Comparator.comparingDouble(t -> t.elapsedSeconds().getAsDouble()))
                .toList();
        if (timed.size() < 2) {
            return new DatasetComparison(dataset, Optional.empty(), OptionalDouble.empty(), totals);
        }
        double best = timed.get(0).elapsedSeconds().getAsDouble();
        double runnerUp = timed.get(1).elapsedSeconds().getAsDouble();
        double gap = runnerUp - best;
        Optional<String> fastest = gap > 0.0 ? Optional.of(timed.get(0).framework()) : Optional.empty();
        return new DatasetComparison(dataset, fastest, OptionalDouble.of(gap), totals);
    }

    private static OptionalDouble sum(List<MetricsRecord> rows, Function<MetricsRecord, OptionalDouble> field) {
        double[] present = present(rows, field);
        return present.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(Arrays.stream(present).sum());
    }

    private static OptionalDouble mean(List<MetricsRecord> rows, Function<MetricsRecord, OptionalDouble> field) {
        return Arrays.stream(present(rows, field)).average();
    }

    private static double[] present(List<MetricsRecord> rows, Function<MetricsRecord, OptionalDouble> field) {
        return rows.stream()
                .map(field)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
    }

    // ========================================================================
    // Output
    // ========================================================================

    public Result<Path> generate(ComparisonReport report) {
        return Result.of(() -> {
            Path dir = outputFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            mapper.writeValue(outputFile.toFile(), report);
            info("Generated comparison: {}", outputFile);
            return outputFile;
        });
    }

    /**
     * Console rendering, one block per dataset.
     */
    public static String render(ComparisonReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Performance comparison (per-dataset totals)").append(System.lineSeparator());
        for (DatasetComparison ds : report.datasets()) {
            out.append(System.lineSeparator()).append("- ").append(ds.dataset()).append(':').append(System.lineSeparator());
            for (FrameworkTotals t : ds.frameworks()) {
                out.append(String.format(Locale.ROOT, "    %-8s elapsed %s s, max RSS %s KB, avg CPU %s%%, phases %s%n",
                        t.framework(),
                        number(t.elapsedSeconds()),
                        t.maxRssKb().isPresent() ? Long.toString(t.maxRssKb().getAsLong()) : "n/a",
                        number(t.avgCpuUtil()),
                        String.join(",", t.phases())));
            }
            if (ds.fastest().isPresent()) {
                out.append(String.format(Locale.ROOT, "    -> %s faster by %s s%n",
                        ds.fastest().get(), number(ds.elapsedGapSeconds())));
            } else if (ds.isTie()) {
                out.append(String.format("    -> tie%n"));
            }
        }
        return out.toString();
    }

    private static String number(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.2f", value.getAsDouble()) : "n/a";
    }
}
