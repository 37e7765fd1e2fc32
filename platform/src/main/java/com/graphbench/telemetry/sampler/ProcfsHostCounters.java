package com.graphbench.telemetry.sampler;

import com.graphbench.platform.base.Result;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

import static com.graphbench.platform.observe.Log.debug;

/**
 * Linux host counters read from procfs.
 *
 * <ul>
 *   <li>CPU: {@code /proc/stat} aggregate line, busy jiffies over total since the previous read</li>
 *   <li>Memory: {@code MemTotal} and {@code MemAvailable} from {@code /proc/meminfo}</li>
 *   <li>Disk: sectors read/written in {@code /proc/diskstats}, whole devices only</li>
 *   <li>Network: receive/transmit bytes of every interface in {@code /proc/net/dev}</li>
 * </ul>
 *
 * Not thread-safe; one instance belongs to one sampling loop.
 */
public final class ProcfsHostCounters implements HostCounters {

    private static final long SECTOR_BYTES = 512L;

    private final Path procRoot;
    private final Path sysBlock;

    private long lastTotalJiffies = -1;
    private long lastIdleJiffies = -1;

    public ProcfsHostCounters(Path procRoot, Path sysBlock) {
        this.procRoot = procRoot;
        this.sysBlock = sysBlock;
    }

    public static ProcfsHostCounters create() {
        return new ProcfsHostCounters(Path.of("/proc"), Path.of("/sys/block"));
    }

    @Override
    public CounterSnapshot read() {
        double cpu = cpuPercent();
        long[] mem = memInfoKb();
        long[] disk = diskBytes();
        long[] net = netBytes();

        long totalKb = mem[0];
        long usedKb = totalKb > 0 ? Math.max(0, totalKb - mem[1]) : 0;
        return new CounterSnapshot(
                cpu,
                usedKb / 1024.0,
                totalKb > 0 ? usedKb * 100.0 / totalKb : 0.0,
                disk[0],
                disk[1],
                net[1],
                net[0]
        );
    }

    // ========================================================================
    // /proc/stat
    // ========================================================================

    private double cpuPercent() {
        long[] jiffies = Result.of(() -> cpuJiffies(lines("stat")))
                .onFailure(e -> debug("CPU counters unavailable: {}", e.getMessage()))
                .getOrElse(null);
        if (jiffies == null) {
            return 0.0;
        }
        long total = jiffies[0];
        long idle = jiffies[1];
        boolean primed = lastTotalJiffies >= 0;
        long deltaTotal = total - lastTotalJiffies;
        long deltaIdle = idle - lastIdleJiffies;
        lastTotalJiffies = total;
        lastIdleJiffies = idle;
        if (!primed || deltaTotal <= 0) {
            return 0.0;
        }
        double busy = 100.0 * (deltaTotal - deltaIdle) / deltaTotal;
        return Math.max(0.0, Math.min(100.0, busy));
    }

    /**
     * Returns {total, idle} jiffies. Guest time is already part of user time and is not added.
     */
    static long[] cpuJiffies(List<String> stat) {
        for (String line : stat) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 5 || !parts[0].equals("cpu")) {
                continue;
            }
            long total = 0;
            int fields = Math.min(parts.length, 9);
            for (int i = 1; i < fields; i++) {
                total += Long.parseLong(parts[i]);
            }
            long idle = Long.parseLong(parts[4]) + (parts.length > 5 ? Long.parseLong(parts[5]) : 0);
            return new long[] {total, idle};
        }
        throw new IllegalStateException("no aggregate cpu line");
    }

    // ========================================================================
    // /proc/meminfo
    // ========================================================================

    private long[] memInfoKb() {
        return Result.of(() -> memInfo(lines("meminfo")))
                .onFailure(e -> debug("Memory counters unavailable: {}", e.getMessage()))
                .getOrElse(new long[] {0, 0});
    }

    /**
     * Returns {MemTotal, MemAvailable} in kB.
     */
    static long[] memInfo(List<String> meminfo) {
        long total = 0;
        long available = -1;
        for (String line : meminfo) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 2) {
                continue;
            }
            if (parts[0].equals("MemTotal:")) {
                total = Long.parseLong(parts[1]);
            } else if (parts[0].equals("MemAvailable:")) {
                available = Long.parseLong(parts[1]);
            }
        }
        // Without MemAvailable the used share is unknown; report zero used.
        return new long[] {total, available < 0 ? total : available};
    }

    // ========================================================================
    // /proc/diskstats
    // ========================================================================

    private long[] diskBytes() {
        return Result.of(() -> diskStats(lines("diskstats"), this::isWholeDevice))
                .onFailure(e -> debug("Disk counters unavailable: {}", e.getMessage()))
                .getOrElse(new long[] {0, 0});
    }

    private boolean isWholeDevice(String name) {
        if (!Files.isDirectory(sysBlock)) {
            return true;
        }
        return Files.exists(sysBlock.resolve(name.replace('/', '!')));
    }

    /**
     * Returns {read, written} bytes summed over devices accepted by {@code include}.
     */
    static long[] diskStats(List<String> diskstats, Predicate<String> include) {
        long read = 0;
        long written = 0;
        for (String line : diskstats) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 10 || !include.test(parts[2])) {
                continue;
            }
            try {
                read += Long.parseLong(parts[5]) * SECTOR_BYTES;
                written += Long.parseLong(parts[9]) * SECTOR_BYTES;
            } catch (NumberFormatException e) {
                debug("Skipping diskstats line for {}", parts[2]);
            }
        }
        return new long[] {read, written};
    }

    // ========================================================================
    // /proc/net/dev
    // ========================================================================

    private long[] netBytes() {
        return Result.of(() -> netDev(lines("net/dev")))
                .onFailure(e -> debug("Network counters unavailable: {}", e.getMessage()))
                .getOrElse(new long[] {0, 0});
    }

    /**
     * Returns {received, transmitted} bytes summed over all interfaces.
     */
    static long[] netDev(List<String> netdev) {
        long recv = 0;
        long sent = 0;
        for (String line : netdev) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String[] parts = line.substring(colon + 1).trim().split("\\s+");
            if (parts.length < 9) {
                continue;
            }
            try {
                recv += Long.parseLong(parts[0]);
                sent += Long.parseLong(parts[8]);
            } catch (NumberFormatException e) {
                debug("Skipping net/dev line '{}'", line.substring(0, colon).trim());
            }
        }
        return new long[] {recv, sent};
    }

    private List<String> lines(String name) throws IOException {
        return Files.readAllLines(procRoot.resolve(name));
    }
}
