package ru.tsdb.config;

import org.jetbrains.annotations.NotNull;

public class LoggingConfig {

    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";
    public static final String OUTPUT_STDOUT = "stdout";
    public static final String OUTPUT_STDERR = "stderr";

    @NotNull
    private final String level;
    @NotNull
    private final String format;
    @NotNull
    private final String output;

    /**
     * @param output {@code stdout}, {@code stderr} or a file path
     */
    public LoggingConfig(@NotNull String level, @NotNull String format, @NotNull String output) {
        this.level = level;
        this.format = format;
        this.output = output;
    }

    @NotNull
    public static LoggingConfig defaults() {
        return new LoggingConfig("info", FORMAT_TEXT, OUTPUT_STDOUT);
    }

    @NotNull
    static LoggingConfig from(@NotNull EnvVars env) {
        return new LoggingConfig(
                env.getString("LOG_LEVEL", "info"),
                env.getString("LOG_FORMAT", FORMAT_TEXT),
                env.getString("LOG_OUTPUT", OUTPUT_STDOUT));
    }

    @NotNull
    public String getLevel() {
        return level;
    }

    @NotNull
    public String getFormat() {
        return format;
    }

    @NotNull
    public String getOutput() {
        return output;
    }
}
