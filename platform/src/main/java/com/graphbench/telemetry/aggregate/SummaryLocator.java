package com.graphbench.telemetry.aggregate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

import static com.graphbench.platform.observe.Log.*;

/**
 * Finds the most recently written summary table ({@code summary*.csv}) in a metrics
 * directory, so a table that landed in the fallback file is still picked up.
 */
public final class SummaryLocator {

    private SummaryLocator() {}

    public static Optional<Path> newest(Path metricsRoot) {
        if (!Files.isDirectory(metricsRoot)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(metricsRoot)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith("summary") && name.endsWith(".csv");
                    })
                    .max(Comparator.comparing(SummaryLocator::modified)
                            .thenComparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            warn("Cannot list {}: {}", metricsRoot, e.getMessage());
            return Optional.empty();
        }
    }

    private static FileTime modified(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            debug("No modification time for {}", p);
            return FileTime.fromMillis(0);
        }
    }
}
