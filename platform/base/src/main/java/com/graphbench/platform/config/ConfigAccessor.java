package com.graphbench.platform.config;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Simple utility for accessing HOCON config values with defaults.
 *
 * Every accessor returns the default when the path is missing, so callers can
 * build config records from partial overrides (tests, CLI flags) without
 * repeating {@code hasPath} checks.
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    public static String string(Config c, String path, String defaultValue) {
        return c.hasPath(path) ? c.getString(path) : defaultValue;
    }

    public static int intVal(Config c, String path, int defaultValue) {
        return c.hasPath(path) ? c.getInt(path) : defaultValue;
    }

    public static boolean bool(Config c, String path, boolean defaultValue) {
        return c.hasPath(path) ? c.getBoolean(path) : defaultValue;
    }

    public static Duration duration(Config c, String path, Duration defaultValue) {
        return c.hasPath(path) ? c.getDuration(path) : defaultValue;
    }

    public static List<String> stringList(Config c, String path, List<String> defaultValue) {
        return c.hasPath(path) ? c.getStringList(path) : defaultValue;
    }

    public static Optional<Config> nested(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getConfig(path)) : Optional.empty();
    }
}
