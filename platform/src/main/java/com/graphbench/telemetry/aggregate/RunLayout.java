package com.graphbench.telemetry.aggregate;

import com.graphbench.telemetry.model.RunKey;
import com.graphbench.telemetry.parse.SarReportReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Stream;

import static com.graphbench.platform.observe.Log.warn;

/**
 * Where profiler output for one (framework, dataset, phase) lives.
 *
 * Directory structure:
 *   {metricsRoot}/{framework}/{dataset}/{phase}.time
 *   {metricsRoot}/{framework}/{dataset}/{phase}.dstat.csv
 *   {metricsRoot}/{framework}/{dataset}/{phase}.sar.{cpu,mem,dsk,net}.txt
 *   {metricsRoot}/{framework}/{dataset}/{phase}.status
 *
 * A configured framework yields every configured phase for each dataset directory, whether
 * or not its files exist. Any other framework directory yields the phases of its
 * {@code *.time} files.
 */
public final class RunLayout {

    static final String TIME_SUFFIX = ".time";
    static final String DSTAT_SUFFIX = ".dstat.csv";
    static final String STATUS_SUFFIX = ".status";

    private final Path metricsRoot;
    private final Map<String, List<String>> configuredPhases;

    public RunLayout(Path metricsRoot, Map<String, List<String>> configuredPhases) {
        this.metricsRoot = metricsRoot;
        this.configuredPhases = Map.copyOf(configuredPhases);
    }

    public Path metricsRoot() {
        return metricsRoot;
    }

    /**
     * All triples with a dataset directory on disk, in key order.
     */
    public List<RunKey> discover() {
        TreeSet<RunKey> keys = new TreeSet<>();
        for (Path frameworkDir : subdirectories(metricsRoot)) {
            String framework = frameworkDir.getFileName().toString();
            List<String> phases = configuredPhases.get(framework);
            for (Path datasetDir : subdirectories(frameworkDir)) {
                String dataset = datasetDir.getFileName().toString();
                List<String> datasetPhases = phases != null ? phases : timedPhases(datasetDir);
                datasetPhases.forEach(phase -> keys.add(new RunKey(framework, dataset, phase)));
            }
        }
        return new ArrayList<>(keys);
    }

    public Path runDirectory(RunKey key) {
        return metricsRoot.resolve(key.framework()).resolve(key.dataset());
    }

    public Path timeReport(RunKey key) {
        return runDirectory(key).resolve(key.phase() + TIME_SUFFIX);
    }

    public Path dstatLog(RunKey key) {
        return runDirectory(key).resolve(key.phase() + DSTAT_SUFFIX);
    }

    public Path statusFile(RunKey key) {
        return runDirectory(key).resolve(key.phase() + STATUS_SUFFIX);
    }

    public SarReportReader.Reports sarReports(RunKey key) {
        Path dir = runDirectory(key);
        String prefix = key.phase() + ".sar.";
        return new SarReportReader.Reports(
                dir.resolve(prefix + "cpu.txt"),
                dir.resolve(prefix + "mem.txt"),
                dir.resolve(prefix + "dsk.txt"),
                dir.resolve(prefix + "net.txt")
        );
    }

    private static List<String> timedPhases(Path datasetDir) {
        List<String> phases = new ArrayList<>();
        for (Path file : list(datasetDir)) {
            String name = file.getFileName().toString();
            if (Files.isRegularFile(file) && name.endsWith(TIME_SUFFIX) && name.length() > TIME_SUFFIX.length()) {
                phases.add(name.substring(0, name.length() - TIME_SUFFIX.length()));
            }
        }
        return phases;
    }

    private static List<Path> subdirectories(Path dir) {
        return list(dir).stream().filter(Files::isDirectory).toList();
    }

    private static List<Path> list(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().toList();
        } catch (IOException e) {
            warn("Cannot list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }
}
