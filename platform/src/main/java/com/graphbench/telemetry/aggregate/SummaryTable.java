package com.graphbench.telemetry.aggregate;

import com.graphbench.platform.base.Result;
import com.graphbench.telemetry.model.DstatAverages;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.ParsedToolMetrics;
import com.graphbench.telemetry.model.RunKey;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import static com.graphbench.platform.observe.Log.*;

/**
 * The canonical summary table: one row per (framework, dataset, phase), sorted by key,
 * absent values as empty cells.
 *
 * Numbers are written in their shortest round-trip decimal form, never in exponent
 * notation, so the same records always produce the same bytes.
 */
public final class SummaryTable {

    public static final List<String> COLUMNS = List.of(
            "framework",
            "dataset",
            "phase",
            "elapsed_seconds",
            "max_rss_kb",
            "cpu_user_s",
            "cpu_sys_s",
            "avg_cpu_util",
            "avg_mem_used_mb",
            "avg_dsk_read_kbps",
            "avg_dsk_writ_kbps",
            "avg_net_recv_kbps",
            "avg_net_send_kbps"
    );

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(COLUMNS.toArray(String[]::new))
            .setRecordSeparator('\n')
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private SummaryTable() {}

    // ========================================================================
    // Write
    // ========================================================================

    /**
     * Write {@code records} to {@code destination}, or to {@code fallback} when the
     * destination is rejected. Either file is replaced atomically; a failed write leaves
     * the previous content in place.
     */
    public static Result<TableWriteResult> write(Collection<MetricsRecord> records, Path destination, Path fallback) {
        List<MetricsRecord> rows = records.stream()
                .sorted((a, b) -> a.key().compareTo(b.key()))
                .toList();
        return Result.of(() -> {
                    writeAtomically(rows, destination);
                    return new TableWriteResult(destination, false, rows.size());
                })
                .recoverWith(e -> {
                    warn("Cannot write {} ({}); writing {} instead", destination, describe(e), fallback);
                    return Result.of(() -> {
                        writeAtomically(rows, fallback);
                        return new TableWriteResult(fallback, true, rows.size());
                    });
                })
                .onSuccess(r -> info("Wrote {} rows to {}", r.rows(), r.path()));
    }

    private static void writeAtomically(List<MetricsRecord> rows, Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            try (BufferedWriter out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(out, WRITE_FORMAT)) {
                for (MetricsRecord row : rows) {
                    printer.printRecord(cells(row));
                }
            }
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            debug("Atomic move unsupported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static List<String> cells(MetricsRecord r) {
        ParsedToolMetrics t = r.tool();
        DstatAverages a = r.averages();
        List<String> cells = new ArrayList<>(COLUMNS.size());
        cells.add(r.framework());
        cells.add(r.dataset());
        cells.add(r.phase());
        cells.add(cell(t.elapsedSeconds()));
        cells.add(t.maxRssKb().isPresent() ? Long.toString(t.maxRssKb().getAsLong()) : "");
        cells.add(cell(t.userCpuSeconds()));
        cells.add(cell(t.systemCpuSeconds()));
        cells.add(cell(a.avgCpuUtil()));
        cells.add(cell(a.avgMemUsedMb()));
        cells.add(cell(a.avgDskReadKbps()));
        cells.add(cell(a.avgDskWritKbps()));
        cells.add(cell(a.avgNetRecvKbps()));
        cells.add(cell(a.avgNetSendKbps()));
        return cells;
    }

    static String cell(OptionalDouble value) {
        if (value.isEmpty()) {
            return "";
        }
        double v = value.getAsDouble();
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return "";
        }
        String shortest = Double.toString(v);
        return shortest.indexOf('E') < 0 ? shortest : new BigDecimal(shortest).stripTrailingZeros().toPlainString();
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }

    // ========================================================================
    // Read
    // ========================================================================

    /**
     * Read a table written by {@link #write}, or by an older tool with the same columns.
     * Rows without framework, dataset and phase are skipped; unparsable numbers read as absent.
     */
    public static List<MetricsRecord> read(Path table) {
        if (!Files.isRegularFile(table)) {
            return List.of();
        }
        return Result.of(() -> {
                    try (Reader in = Files.newBufferedReader(table, StandardCharsets.UTF_8);
                         CSVParser parser = CSVParser.parse(in, READ_FORMAT)) {
                        List<MetricsRecord> rows = new ArrayList<>();
                        for (CSVRecord record : parser) {
                            toRecord(record).ifPresent(rows::add);
                        }
                        return List.copyOf(rows);
                    }
                })
                .onFailure(e -> warn("Cannot read {}: {}", table, e.getMessage()))
                .getOrElse(List.of());
    }

    private static Optional<MetricsRecord> toRecord(CSVRecord r) {
        String framework = text(r, "framework");
        String dataset = text(r, "dataset");
        String phase = text(r, "phase");
        if (framework.isEmpty() || dataset.isEmpty() || phase.isEmpty()) {
            debug("Skipping summary row {} without a key", r.getRecordNumber());
            return Optional.empty();
        }
        OptionalDouble rss = number(r, "max_rss_kb");
        ParsedToolMetrics tool = new ParsedToolMetrics(
                number(r, "elapsed_seconds"),
                number(r, "cpu_user_s"),
                number(r, "cpu_sys_s"),
                rss.isPresent() ? OptionalLong.of(Math.round(rss.getAsDouble())) : OptionalLong.empty()
        );
        DstatAverages averages = new DstatAverages(
                number(r, "avg_cpu_util"),
                number(r, "avg_mem_used_mb"),
                number(r, "avg_dsk_read_kbps"),
                number(r, "avg_dsk_writ_kbps"),
                number(r, "avg_net_recv_kbps"),
                number(r, "avg_net_send_kbps")
        );
        return Optional.of(new MetricsRecord(new RunKey(framework, dataset, phase), tool, averages));
    }

    private static String text(CSVRecord r, String column) {
        return r.isMapped(column) && r.isSet(column) ? r.get(column).trim() : "";
    }

    private static OptionalDouble number(CSVRecord r, String column) {
        String s = text(r, column);
        if (s.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            debug("Unparsable {} '{}' in row {}", column, s, r.getRecordNumber());
            return OptionalDouble.empty();
        }
    }
}
