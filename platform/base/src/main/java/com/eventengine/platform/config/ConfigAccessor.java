package com.eventengine.platform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Null-free reads of optional HOCON paths.
 *
 * <pre>
 *   Duration timeout = ConfigAccessor.duration(kafka, "poll-timeout", Duration.ofMillis(500));
 *   Config fixture = ConfigAccessor.section(root, "fixture");
 * </pre>
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    /**
     * The value at {@code path}, empty when the path is missing or blank.
     */
    public static Optional<String> nonBlankString(Config c, String path) {
        return c.hasPath(path)
                ? Optional.of(c.getString(path)).filter(value -> !value.isBlank())
                : Optional.empty();
    }

    public static String string(Config c, String path, String defaultValue) {
        return nonBlankString(c, path).orElse(defaultValue);
    }

    public static int intVal(Config c, String path, int defaultValue) {
        return c.hasPath(path) ? c.getInt(path) : defaultValue;
    }

    /**
     * Accepts HOCON duration syntax: {@code 500ms}, {@code 2s}, {@code 1m}.
     */
    public static Duration duration(Config c, String path, Duration defaultValue) {
        return c.hasPath(path) ? c.getDuration(path) : defaultValue;
    }

    /**
     * The sub-config at {@code path}, or an empty config so callers fall back to their defaults.
     */
    public static Config section(Config c, String path) {
        return c.hasPath(path) ? c.getConfig(path) : ConfigFactory.empty();
    }
}
