package com.graphbench.telemetry.parse;

import com.graphbench.telemetry.model.DstatAverages;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.graphbench.platform.observe.Log.debug;

/**
 * Reads run averages from sysstat {@code sar} text reports, captured with {@code LC_ALL=C}.
 *
 * Each report prefers its trailing {@code Average:} row and otherwise averages the data rows.
 * A row that does not parse is skipped.
 */
public final class SarReportReader {

    private static final String AVERAGE = "Average:";
    private static final String LOOPBACK = "lo";

    /**
     * The four report variants captured for one run; any of them may be missing.
     */
    public record Reports(Path cpu, Path memory, Path disk, Path network) {}

    public record DiskRates(OptionalDouble readKbps, OptionalDouble writeKbps) {
        static final DiskRates NONE = new DiskRates(OptionalDouble.empty(), OptionalDouble.empty());
    }

    public record NetRates(OptionalDouble recvKbps, OptionalDouble sendKbps) {
        static final NetRates NONE = new NetRates(OptionalDouble.empty(), OptionalDouble.empty());
    }

    public DstatAverages read(Reports reports) {
        DiskRates disk = disk(TextFiles.readLines(reports.disk()));
        NetRates net = network(TextFiles.readLines(reports.network()));
        return new DstatAverages(
                cpuUtil(TextFiles.readLines(reports.cpu())),
                memUsedMb(TextFiles.readLines(reports.memory())),
                disk.readKbps(),
                disk.writeKbps(),
                net.recvKbps(),
                net.sendKbps()
        );
    }

    // ========================================================================
    // sar -u
    // ========================================================================

    /**
     * CPU utilisation as 100 minus {@code %idle} (last column).
     */
    public OptionalDouble cpuUtil(List<String> lines) {
        String average = lastAverageRow(lines);
        if (average != null) {
            String[] parts = fields(average);
            if (parts.length >= 8) {
                OptionalDouble idle = number(parts[parts.length - 1]);
                if (idle.isPresent()) {
                    return OptionalDouble.of(100.0 - idle.getAsDouble());
                }
            }
        }
        List<Double> values = new ArrayList<>();
        for (String line : dataRows(lines)) {
            String[] parts = fields(line);
            if (parts.length >= 8) {
                number(parts[parts.length - 1]).ifPresent(idle -> values.add(100.0 - idle));
            }
        }
        return mean(values);
    }

    // ========================================================================
    // sar -r
    // ========================================================================

    /**
     * Memory used in MB from {@code kbmemused} (field index 3).
     */
    public OptionalDouble memUsedMb(List<String> lines) {
        String average = lastAverageRow(lines);
        if (average != null) {
            String[] parts = fields(average);
            if (parts.length >= 4) {
                OptionalDouble used = number(parts[3]);
                if (used.isPresent()) {
                    return OptionalDouble.of(used.getAsDouble() / 1024.0);
                }
            }
        }
        List<Double> values = new ArrayList<>();
        for (String line : dataRows(lines)) {
            String[] parts = fields(line);
            if (parts.length >= 4) {
                number(parts[3]).ifPresent(used -> values.add(used / 1024.0));
            }
        }
        return mean(values);
    }

    // ========================================================================
    // sar -b
    // ========================================================================

    /**
     * Read/write rates from the last two columns ({@code bread/s bwrtn/s}).
     */
    public DiskRates disk(List<String> lines) {
        if (lines.isEmpty()) {
            return DiskRates.NONE;
        }
        String average = lastAverageRow(lines);
        if (average != null) {
            String[] parts = fields(average);
            if (parts.length >= 6) {
                OptionalDouble read = number(parts[parts.length - 2]);
                OptionalDouble write = number(parts[parts.length - 1]);
                if (read.isPresent() && write.isPresent()) {
                    return new DiskRates(read, write);
                }
            }
        }
        List<Double> reads = new ArrayList<>();
        List<Double> writes = new ArrayList<>();
        for (String line : dataRows(lines)) {
            String[] parts = fields(line);
            if (parts.length >= 6) {
                OptionalDouble read = number(parts[parts.length - 2]);
                OptionalDouble write = number(parts[parts.length - 1]);
                if (read.isPresent() && write.isPresent()) {
                    reads.add(read.getAsDouble());
                    writes.add(write.getAsDouble());
                }
            }
        }
        return new DiskRates(mean(reads), mean(writes));
    }

    // ========================================================================
    // sar -n DEV
    // ========================================================================

    /**
     * Receive/send KB/s summed over every interface except loopback.
     */
    public NetRates network(List<String> lines) {
        if (lines.isEmpty()) {
            return NetRates.NONE;
        }
        double totalRx = 0.0;
        double totalTx = 0.0;
        boolean anyDevice = false;
        for (String line : lines) {
            if (!line.startsWith(AVERAGE)) {
                continue;
            }
            String[] parts = fields(line);
            if (parts.length < 6) {
                continue;
            }
            String iface = parts[1];
            if (iface.equalsIgnoreCase("IFACE") || iface.equals(LOOPBACK)) {
                continue;
            }
            OptionalDouble rx = number(parts[4]);
            OptionalDouble tx = number(parts[5]);
            if (rx.isPresent() && tx.isPresent()) {
                totalRx += rx.getAsDouble();
                totalTx += tx.getAsDouble();
                anyDevice = true;
            }
        }
        if (anyDevice) {
            return new NetRates(OptionalDouble.of(totalRx), OptionalDouble.of(totalTx));
        }
        return perTimestamp(lines);
    }

    private NetRates perTimestamp(List<String> lines) {
        Map<String, double[]> byTime = new LinkedHashMap<>();
        for (String line : lines) {
            if (line.contains("IFACE") || line.isBlank() || line.startsWith("Linux") || line.startsWith(AVERAGE)) {
                continue;
            }
            String[] parts = fields(line);
            if (parts.length < 6 || parts[1].equals(LOOPBACK)) {
                continue;
            }
            OptionalDouble rx = number(parts[4]);
            OptionalDouble tx = number(parts[5]);
            if (rx.isEmpty() || tx.isEmpty()) {
                continue;
            }
            double[] sums = byTime.computeIfAbsent(parts[0], k -> new double[2]);
            sums[0] += rx.getAsDouble();
            sums[1] += tx.getAsDouble();
        }
        if (byTime.isEmpty()) {
            return NetRates.NONE;
        }
        double rx = byTime.values().stream().mapToDouble(s -> s[0]).sum() / byTime.size();
        double tx = byTime.values().stream().mapToDouble(s -> s[1]).sum() / byTime.size();
        return new NetRates(OptionalDouble.of(rx), OptionalDouble.of(tx));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static String lastAverageRow(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).startsWith(AVERAGE)) {
                return lines.get(i);
            }
        }
        return null;
    }

    /**
     * Lines that are neither banner, column header, blank nor summary.
     */
    private static List<String> dataRows(List<String> lines) {
        List<String> rows = new ArrayList<>();
        for (String line : lines) {
            if (line.contains("%") || line.isBlank() || line.startsWith("Linux") || line.startsWith(AVERAGE)) {
                continue;
            }
            rows.add(line);
        }
        return rows;
    }

    private static String[] fields(String line) {
        return line.strip().split("\\s+");
    }

    private static OptionalDouble number(String s) {
        try {
            return OptionalDouble.of(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            debug("Skipping non-numeric sar field '{}'", s);
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average();
    }
}
