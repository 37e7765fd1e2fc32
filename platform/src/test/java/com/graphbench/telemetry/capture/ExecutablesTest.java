package com.graphbench.telemetry.capture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutablesTest {

    @TempDir
    Path dir;

    private Path file(String name, String permissions) throws Exception {
        Path f = Files.writeString(dir.resolve(name), "#!/bin/sh\n");
        Files.setPosixFilePermissions(f, PosixFilePermissions.fromString(permissions));
        return f;
    }

    @Test
    void searchesPathInOrder() throws Exception {
        Path second = Files.createDirectories(dir.resolve("second"));
        Path tool = Files.writeString(second.resolve("sar"), "#!/bin/sh\n");
        Files.setPosixFilePermissions(tool, PosixFilePermissions.fromString("rwxr-xr-x"));
        String searchPath = dir.resolve("first") + File.pathSeparator + second;

        assertEquals(Optional.of(tool), Executables.resolve("sar", searchPath));
        assertTrue(Executables.resolve("dstat", searchPath).isEmpty());
    }

    @Test
    void nameWithSlashIsUsedAsIs() throws Exception {
        Path tool = file("time", "rwxr-xr-x");

        assertEquals(Optional.of(tool), Executables.resolve(tool.toString(), null));
        assertTrue(Executables.resolve(dir.resolve("missing").toString(), null).isEmpty());
    }

    @Test
    void nonExecutableFileIsIgnored() throws Exception {
        file("dstat", "rw-r--r--");

        assertTrue(Executables.resolve("dstat", dir.toString()).isEmpty());
    }
}
