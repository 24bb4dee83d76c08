package ru.tsdb.config;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public class ServerConfig {

    static final int DEFAULT_PORT = 8080;
    static final long DEFAULT_READ_TIMEOUT = 30;
    static final long DEFAULT_WRITE_TIMEOUT = 30;
    static final long DEFAULT_IDLE_TIMEOUT = 120;
    static final long DEFAULT_SHUTDOWN_TIMEOUT = 30;

    private final int port;
    @NotNull
    private final Duration readTimeout;
    @NotNull
    private final Duration writeTimeout;
    @NotNull
    private final Duration idleTimeout;
    @NotNull
    private final Duration shutdownTimeout;

    public ServerConfig(int port,
                        @NotNull Duration readTimeout,
                        @NotNull Duration writeTimeout,
                        @NotNull Duration idleTimeout,
                        @NotNull Duration shutdownTimeout) {
        this.port = port;
        this.readTimeout = readTimeout;
        this.writeTimeout = writeTimeout;
        this.idleTimeout = idleTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    @NotNull
    public static ServerConfig defaults() {
        return new ServerConfig(
                DEFAULT_PORT,
                Duration.ofSeconds(DEFAULT_READ_TIMEOUT),
                Duration.ofSeconds(DEFAULT_WRITE_TIMEOUT),
                Duration.ofSeconds(DEFAULT_IDLE_TIMEOUT),
                Duration.ofSeconds(DEFAULT_SHUTDOWN_TIMEOUT));
    }

    @NotNull
    static ServerConfig from(@NotNull EnvVars env) {
        return new ServerConfig(
                env.getInt("PORT", DEFAULT_PORT),
                env.getSeconds("READ_TIMEOUT", DEFAULT_READ_TIMEOUT),
                env.getSeconds("WRITE_TIMEOUT", DEFAULT_WRITE_TIMEOUT),
                env.getSeconds("IDLE_TIMEOUT", DEFAULT_IDLE_TIMEOUT),
                env.getSeconds("SHUTDOWN_TIMEOUT", DEFAULT_SHUTDOWN_TIMEOUT));
    }

    /**
     * @return the configured port, {@code 0} binds an ephemeral one
     */
    public int getPort() {
        return port;
    }

    @NotNull
    public Duration getReadTimeout() {
        return readTimeout;
    }

    @NotNull
    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    @NotNull
    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    @NotNull
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }
}
