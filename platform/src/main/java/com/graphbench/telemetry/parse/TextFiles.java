package com.graphbench.telemetry.parse;

import com.graphbench.platform.base.Result;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.graphbench.platform.observe.Log.warn;

/**
 * Lenient text input for profiler logs: undecodable bytes are dropped, a missing file
 * reads as no lines, and an unreadable file is logged and also reads as no lines.
 */
public final class TextFiles {

    private TextFiles() {}

    public static List<String> readLines(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return List.of();
        }
        return Result.of(() -> {
                    try (BufferedReader reader = open(file)) {
                        return reader.lines().toList();
                    }
                })
                .onFailure(e -> warn("Cannot read {}: {}", file, e.getMessage()))
                .getOrElse(List.of());
    }

    static BufferedReader open(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    }
}
