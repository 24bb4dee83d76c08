package ru.tsdb.config;

import org.jetbrains.annotations.NotNull;
import ru.tsdb.errors.TSDBException;

import java.time.Duration;
import java.util.Map;

/**
 * Service configuration: server, storage and logging sections.
 * <p>
 * Loaded from environment variables, see {@link #fromEnvironment(Map)} for the recognised names.
 */
public class TSDBConfig {

    private static final int MAX_PORT = 65535;

    @NotNull
    private final ServerConfig server;
    @NotNull
    private final StorageConfig storage;
    @NotNull
    private final LoggingConfig logging;

    public TSDBConfig(@NotNull ServerConfig server,
                      @NotNull StorageConfig storage,
                      @NotNull LoggingConfig logging) {
        this.server = server;
        this.storage = storage;
        this.logging = logging;
    }

    /**
     * Loads the configuration from the process environment.
     */
    @NotNull
    public static TSDBConfig load() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Recognised variables:
     * {@code PORT}, {@code READ_TIMEOUT}, {@code WRITE_TIMEOUT}, {@code IDLE_TIMEOUT},
     * {@code SHUTDOWN_TIMEOUT} (seconds), {@code DATA_FILE}, {@code MAX_FILE_SIZE} (bytes),
     * {@code BACKUP_DIR}, {@code COMPRESSION}, {@code LOG_LEVEL}, {@code LOG_FORMAT}, {@code LOG_OUTPUT}.
     */
    @NotNull
    public static TSDBConfig fromEnvironment(@NotNull Map<String, String> env) {
        final EnvVars vars = new EnvVars(env);
        return new TSDBConfig(
                ServerConfig.from(vars),
                StorageConfig.from(vars),
                LoggingConfig.from(vars));
    }

    @NotNull
    public static TSDBConfig defaults() {
        return new TSDBConfig(ServerConfig.defaults(), StorageConfig.defaults(), LoggingConfig.defaults());
    }

    @NotNull
    public ServerConfig getServer() {
        return server;
    }

    @NotNull
    public StorageConfig getStorage() {
        return storage;
    }

    @NotNull
    public LoggingConfig getLogging() {
        return logging;
    }

    /**
     * @throws TSDBException of kind validation describing the first invalid setting
     */
    public void validate() throws TSDBException {
        if (server.getPort() < 0 || server.getPort() > MAX_PORT) {
            throw TSDBException.validation("invalid port: " + server.getPort())
                    .withContext("port", server.getPort());
        }
        requirePositive("read timeout", server.getReadTimeout());
        requirePositive("write timeout", server.getWriteTimeout());
        requirePositive("idle timeout", server.getIdleTimeout());
        requirePositive("shutdown timeout", server.getShutdownTimeout());

        if (storage.getDataFile().trim().isEmpty()) {
            throw TSDBException.validation("data file must not be empty");
        }
        if (storage.getMaxFileSize() > 0 && storage.getBackupDir().trim().isEmpty()) {
            throw TSDBException.validation("backup directory must not be empty when rotation is enabled");
        }

        final String format = logging.getFormat();
        if (!LoggingConfig.FORMAT_TEXT.equals(format) && !LoggingConfig.FORMAT_JSON.equals(format)) {
            throw TSDBException.validation("unknown log format: " + format)
                    .withContext("format", format);
        }
    }

    private static void requirePositive(@NotNull String name,
                                        @NotNull Duration value) throws TSDBException {
        if (value.isNegative() || value.isZero()) {
            throw TSDBException.validation(name + " must be positive: " + value.getSeconds() + "s");
        }
    }

    @Override
    public String toString() {
        return "TimeSeriesDB Configuration:\n"
                + "Server:\n"
                + "  Port: " + server.getPort() + "\n"
                + "  ReadTimeout: " + server.getReadTimeout().getSeconds() + "s\n"
                + "  WriteTimeout: " + server.getWriteTimeout().getSeconds() + "s\n"
                + "  IdleTimeout: " + server.getIdleTimeout().getSeconds() + "s\n"
                + "  ShutdownTimeout: " + server.getShutdownTimeout().getSeconds() + "s\n"
                + "Storage:\n"
                + "  DataFile: " + storage.getDataFile() + "\n"
                + "  MaxFileSize: " + storage.getMaxFileSize() + "\n"
                + "  BackupDir: " + storage.getBackupDir() + "\n"
                + "  Compression: " + storage.isCompression() + "\n"
                + "Logging:\n"
                + "  Level: " + logging.getLevel() + "\n"
                + "  Format: " + logging.getFormat() + "\n"
                + "  Output: " + logging.getOutput() + "\n";
    }
}
