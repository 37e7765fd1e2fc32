package com.graphbench.telemetry.capture;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates profiler binaries the way a shell's {@code command -v} does.
 */
final class Executables {

    private Executables() {}

    /**
     * {@code name} itself when it contains a slash, otherwise the first match on {@code PATH}.
     */
    static Optional<Path> resolve(String name) {
        return resolve(name, System.getenv("PATH"));
    }

    static Optional<Path> resolve(String name, String searchPath) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        if (name.indexOf('/') >= 0) {
            return executable(name);
        }
        if (searchPath == null) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Optional<Path> found = executable(dir + "/" + name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> executable(String candidate) {
        try {
            Path path = Path.of(candidate);
            return Files.isRegularFile(path) && Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
