package ru.tsdb.config;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Typed lookups over a set of environment variables.
 * <p>
 * An unset or blank variable yields the default, so does a value that does not parse
 * (with a warning).
 */
final class EnvVars {

    private static final Logger log = LoggerFactory.getLogger(EnvVars.class);

    @NotNull
    private final Map<String, String> env;

    EnvVars(@NotNull Map<String, String> env) {
        this.env = env;
    }

    @NotNull
    String getString(@NotNull String key, @NotNull String defaultValue) {
        final String value = env.get(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    int getInt(@NotNull String key, int defaultValue) {
        final String value = getString(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    long getLong(@NotNull String key, long defaultValue) {
        final String value = getString(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    boolean getBoolean(@NotNull String key, boolean defaultValue) {
        final String value = getString(key, "");
        switch (value.toLowerCase(Locale.ROOT)) {
            case "":
                return defaultValue;
            case "1":
            case "t":
            case "true":
                return true;
            case "0":
            case "f":
            case "false":
                return false;
            default:
                log.warn("Ignoring {}={}: not a boolean, using {}", key, value, defaultValue);
                return defaultValue;
        }
    }

    /**
     * Durations are given in whole seconds.
     */
    @NotNull
    Duration getSeconds(@NotNull String key, long defaultSeconds) {
        return Duration.ofSeconds(getLong(key, defaultSeconds));
    }
}
