package com.graphbench.telemetry.parse;

import com.graphbench.platform.config.TelemetryConfig.ParseConfig;
import com.graphbench.telemetry.model.DstatAverages;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

import static com.graphbench.platform.observe.Log.debug;

/**
 * Averages a dstat {@code --output} CSV over the whole run.
 *
 * dstat writes a banner, a few metadata rows and then one or more header blocks
 * (a row whose first cell is {@code time}) each followed by data rows. Columns are
 * located by substring match on the header labels, so 0.7.x and 0.8.x layouts both
 * work. Sums run across all header blocks of a file; each block contributes with the
 * column positions resolved from its own header.
 */
public final class DstatCsvReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private static final double BYTES_PER_MIB = 1024.0 * 1024.0;

    /**
     * Metric columns and the header labels that identify them, most specific first.
     */
    public enum Column {
        CPU_USR("usr"),
        CPU_SYS("sys"),
        CPU_IDL("idl"),
        MEM_USED("used"),
        DSK_READ("io/total read", "dsk/total read", "read"),
        DSK_WRIT("io/total writ", "dsk/total writ", "writ"),
        NET_RECV("net/total recv", "recv"),
        NET_SEND("net/total send", "send");

        private final List<String> labels;

        Column(String... labels) {
            this.labels = List.of(labels);
        }

        /**
         * Index of the first header cell containing any of this column's labels.
         */
        Optional<Integer> locate(List<String> header) {
            for (int i = 0; i < header.size(); i++) {
                String cell = header.get(i).strip().toLowerCase(Locale.ROOT);
                for (String label : labels) {
                    if (cell.contains(label)) {
                        return Optional.of(i);
                    }
                }
            }
            return Optional.empty();
        }
    }

    private final boolean zeroThroughputAsAbsent;

    public DstatCsvReader(ParseConfig config) {
        this.zeroThroughputAsAbsent = config.zeroThroughputAsAbsent();
    }

    public DstatAverages read(Path csv) {
        return parse(TextFiles.readLines(csv));
    }

    public DstatAverages parse(List<String> lines) {
        Accumulator acc = new Accumulator();
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            Optional<List<String>> row = cells(line, lineNo);
            row.ifPresent(acc::accept);
        }
        return acc.averages();
    }

    private static Optional<List<String>> cells(String line, int lineNo) {
        try (CSVParser parser = CSVParser.parse(line, FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                return Optional.empty();
            }
            List<String> values = new ArrayList<>();
            records.get(0).forEach(values::add);
            return Optional.of(values);
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            debug("Skipping malformed dstat line {}: {}", lineNo, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isHeader(List<String> row) {
        return !row.isEmpty() && row.get(0).strip().equalsIgnoreCase("time");
    }

    private static OptionalDouble number(String cell) {
        String s = cell.strip();
        if (s.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Running sums for one file. Not thread-safe; one per {@link #parse} call.
     */
    private final class Accumulator {
        private final Map<Column, Integer> columns = new EnumMap<>(Column.class);
        private final Set<Column> resolved = EnumSet.noneOf(Column.class);
        private final double[] sums = new double[Column.values().length];
        private final int[] counts = new int[Column.values().length];
        private List<String> header;
        private int samples;
        private int headerBlocks;

        void accept(List<String> row) {
            if (isHeader(row)) {
                onHeader(row);
                return;
            }
            if (header == null || row.size() < header.size()) {
                return;
            }
            samples++;
            columns.forEach((column, index) -> {
                if (index < row.size()) {
                    number(row.get(index)).ifPresent(v -> {
                        sums[column.ordinal()] += v;
                        counts[column.ordinal()]++;
                    });
                }
            });
        }

        private void onHeader(List<String> row) {
            headerBlocks++;
            if (headerBlocks > 1 && samples > 0) {
                debug("dstat header block {} after {} samples; continuing running averages", headerBlocks, samples);
            }
            header = row;
            columns.clear();
            for (Column column : Column.values()) {
                column.locate(row).ifPresent(index -> {
                    columns.put(column, index);
                    resolved.add(column);
                });
            }
        }

        DstatAverages averages() {
            if (samples == 0) {
                return DstatAverages.empty();
            }
            return new DstatAverages(
                    cpuUtil(),
                    has(Column.MEM_USED) ? OptionalDouble.of(mean(Column.MEM_USED) / BYTES_PER_MIB) : OptionalDouble.empty(),
                    throughput(Column.DSK_READ),
                    throughput(Column.DSK_WRIT),
                    throughput(Column.NET_RECV),
                    throughput(Column.NET_SEND)
            );
        }

        private OptionalDouble cpuUtil() {
            if (has(Column.CPU_IDL)) {
                return OptionalDouble.of(100.0 - mean(Column.CPU_IDL));
            }
            if (has(Column.CPU_USR) || has(Column.CPU_SYS)) {
                return OptionalDouble.of((sums[Column.CPU_USR.ordinal()] + sums[Column.CPU_SYS.ordinal()]) / samples);
            }
            return OptionalDouble.empty();
        }

        private OptionalDouble throughput(Column column) {
            double sum = sums[column.ordinal()];
            if (zeroThroughputAsAbsent) {
                return sum != 0.0 ? OptionalDouble.of(sum / samples) : OptionalDouble.empty();
            }
            return resolved.contains(column) ? OptionalDouble.of(sum / samples) : OptionalDouble.empty();
        }

        private boolean has(Column column) {
            return counts[column.ordinal()] > 0;
        }

        private double mean(Column column) {
            return sums[column.ordinal()] / samples;
        }
    }
}
