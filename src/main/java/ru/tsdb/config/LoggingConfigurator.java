package ru.tsdb.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Applies a {@link LoggingConfig} to the Logback root logger.
 * <p>
 * The level is always applied. The appender from {@code logback.xml} is kept for text output to
 * stdout and replaced otherwise.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";
    private static final String APPENDER_NAME = "TSDB";

    private LoggingConfigurator() {
        // Not instantiable
    }

    public static void apply(@NotNull LoggingConfig config) {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            log.warn("Logging backend {} does not support reconfiguration, keeping defaults",
                    factory.getClass().getName());
            return;
        }
        final LoggerContext context = (LoggerContext) factory;
        final Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(toLevel(config.getLevel()));

        final boolean json = LoggingConfig.FORMAT_JSON.equals(config.getFormat());
        if (!json && LoggingConfig.OUTPUT_STDOUT.equals(config.getOutput())) {
            return;
        }

        final OutputStreamAppender<ILoggingEvent> appender = createAppender(config.getOutput());
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(json ? jsonEncoder(context) : patternEncoder(context));
        appender.start();

        root.detachAndStopAllAppenders();
        root.addAppender(appender);
        log.info("Logging configured: level={}, format={}, output={}",
                root.getLevel(), config.getFormat(), config.getOutput());
    }

    @NotNull
    static Level toLevel(@NotNull String level) {
        switch (level.toLowerCase(Locale.ROOT)) {
            case "trace":
                return Level.TRACE;
            case "debug":
                return Level.DEBUG;
            case "warn":
            case "warning":
                return Level.WARN;
            case "error":
            case "fatal":
            case "panic":
                return Level.ERROR;
            default:
                return Level.INFO;
        }
    }

    @NotNull
    private static OutputStreamAppender<ILoggingEvent> createAppender(@NotNull String output) {
        if (LoggingConfig.OUTPUT_STDOUT.equals(output)) {
            return new ConsoleAppender<>();
        }
        if (LoggingConfig.OUTPUT_STDERR.equals(output)) {
            final ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
            console.setTarget("System.err");
            return console;
        }
        final FileAppender<ILoggingEvent> file = new FileAppender<>();
        file.setFile(output);
        file.setAppend(true);
        return file;
    }

    @NotNull
    private static Encoder<ILoggingEvent> patternEncoder(@NotNull LoggerContext context) {
        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();
        return encoder;
    }

    @NotNull
    private static Encoder<ILoggingEvent> jsonEncoder(@NotNull LoggerContext context) {
        final JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }
}
