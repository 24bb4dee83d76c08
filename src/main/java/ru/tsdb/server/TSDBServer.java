package ru.tsdb.server;

import com.sun.net.httpserver.HttpServer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tsdb.TSDBService;
import ru.tsdb.config.ServerConfig;
import ru.tsdb.config.TSDBConfig;
import ru.tsdb.errors.ErrorType;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.http.ConnectionTracker;
import ru.tsdb.http.Router;
import ru.tsdb.metrics.MetricNames;
import ru.tsdb.metrics.MetricsRecorder;
import ru.tsdb.storage.FileStorage;
import ru.tsdb.storage.Storage;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the HTTP listener and the storage, drives the {@link ServerStatus} state machine and
 * counts the requests in progress so that shutdown can drain them.
 */
public class TSDBServer implements TSDBService, ConnectionTracker {

    private static final Logger log = LoggerFactory.getLogger(TSDBServer.class);

    private static final int BACKLOG = 0;
    private static final long COLLECT_INTERVAL_SECONDS = 10;
    private static final long EXECUTOR_STOP_SECONDS = 1;
    private static final long MAX_WAIT_NANOS = Long.MAX_VALUE / 4;

    @NotNull
    private final TSDBConfig config;
    @Nullable
    private final Storage storage;
    @NotNull
    private final MetricsRecorder metrics;
    @NotNull
    private final HttpServer server;
    @NotNull
    private final Instant startTime;

    private final ExecutorService executor = Executors.newCachedThreadPool(threads("tsdb-http-"));
    private final ScheduledExecutorService collector =
            Executors.newSingleThreadScheduledExecutor(threads("tsdb-metrics-"));

    private final AtomicReference<ServerStatus> status = new AtomicReference<>(ServerStatus.STARTING);
    private final AtomicLong connections = new AtomicLong();
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean shutdownStarted = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private final Lock drainLock = new ReentrantLock();
    private final Condition drained = drainLock.newCondition();

    /**
     * Opens the storage described by {@code config} and builds the server around it.
     *
     * @throws TSDBException of kind validation if {@code config} is {@code null} or invalid,
     *                       of kind storage if the data file cannot be opened
     */
    @NotNull
    public static TSDBServer create(@Nullable TSDBConfig config,
                                    @NotNull MetricsRecorder metrics) throws TSDBException {
        if (config == null) {
            throw TSDBException.validation("config cannot be null");
        }
        config.validate();
        final Storage storage;
        try {
            storage = new FileStorage(config.getStorage(), metrics);
        } catch (IOException e) {
            throw TSDBException.wrap(e, ErrorType.STORAGE, "failed to open storage")
                    .withContext("data_file", config.getStorage().getDataFile());
        }
        return new TSDBServer(config, storage, metrics);
    }

    /**
     * @param storage may be {@code null}, writes then fail with a storage error
     */
    public TSDBServer(@Nullable TSDBConfig config,
                      @Nullable Storage storage,
                      @NotNull MetricsRecorder metrics) throws TSDBException {
        if (config == null) {
            throw TSDBException.validation("config cannot be null");
        }
        config.validate();
        this.config = config;
        this.storage = storage;
        this.metrics = metrics;
        try {
            this.server = HttpServer.create();
        } catch (IOException e) {
            throw TSDBException.wrap(e, ErrorType.NETWORK, "failed to create HTTP server");
        }
        new Router(storage, metrics, this, this::isHealthy).register(server);
        this.startTime = Instant.now();

        initializeMetrics();
    }

    /**
     * Applies the read, write and idle timeouts to the JDK HTTP server. Those are process-wide
     * and must be set before the first server is created.
     */
    public static void configureHttpTimeouts(@NotNull ServerConfig config) {
        System.setProperty("sun.net.httpserver.maxReqTime", Long.toString(config.getReadTimeout().getSeconds()));
        System.setProperty("sun.net.httpserver.maxRspTime", Long.toString(config.getWriteTimeout().getSeconds()));
        System.setProperty("sun.net.httpserver.idleInterval", Long.toString(config.getIdleTimeout().getSeconds()));
    }

    @Override
    public void start() throws TSDBException {
        if (status.get() != ServerStatus.STARTING || !started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server cannot be started in state " + status.get());
        }
        final int port = config.getServer().getPort();
        log.info("Starting TimeSeriesDB on port {}...", port);
        log.info("{}", config);
        try {
            server.bind(new InetSocketAddress(port), BACKLOG);
        } catch (IOException e) {
            metrics.increment(MetricNames.SERVER_ERRORS, "bind_error", "http_server");
            throw TSDBException.wrap(e, ErrorType.NETWORK, "failed to bind port " + port)
                    .withContext("port", port);
        }
        server.setExecutor(executor);
        try {
            server.start();
        } catch (IllegalStateException e) {
            if (status.get() == ServerStatus.STARTING) {
                throw e;
            }
            log.debug("Server was shut down before the listener started");
            return;
        }

        if (!status.compareAndSet(ServerStatus.STARTING, ServerStatus.RUNNING)) {
            return;
        }
        publishStatus();
        scheduleCollector();
        log.info("Metrics available at: http://localhost:{}{}", getPort(), Router.URL_METRICS);
    }

    private void scheduleCollector() {
        try {
            collector.scheduleAtFixedRate(this::collectMetrics,
                    COLLECT_INTERVAL_SECONDS, COLLECT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Runtime metrics not scheduled, server is shutting down");
        }
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    @Override
    public void shutdown(@Nullable Duration timeout) throws TSDBException {
        if (timeout == null) {
            throw TSDBException.validation("shutdown timeout cannot be null");
        }
        final long deadline = System.nanoTime() + toWaitNanos(timeout);
        if (!shutdownStarted.compareAndSet(false, true)) {
            awaitShutdownInProgress(deadline);
            return;
        }
        doShutdown(deadline);
    }

    @Override
    public void close() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            awaitTerminationUninterruptibly();
            return;
        }
        try {
            doShutdown(System.nanoTime());
        } catch (TSDBException e) {
            log.warn("Shutdown completed with error: {}", e.getMessage());
        }
    }

    private void doShutdown(long deadline) throws TSDBException {
        log.info("Shutting down server gracefully...");
        status.set(ServerStatus.SHUTTING_DOWN);
        publishStatus();
        final long shutdownStart = System.nanoTime();

        boolean drainedInTime;
        try {
            drainedInTime = awaitDrain(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drainedInTime = false;
        }
        final long abandoned = connections.get();

        stopListener();
        closeStorage();

        status.set(ServerStatus.STOPPED);
        publishStatus();
        metrics.observe(MetricNames.SERVER_SHUTDOWN_DURATION, (System.nanoTime() - shutdownStart) / 1e9);
        terminated.countDown();
        log.info("Server shutdown complete");

        if (!drainedInTime) {
            metrics.increment(MetricNames.SERVER_ERRORS, "shutdown_timeout", "http_server");
            throw TSDBException.timeout("server shutdown timed out before requests finished")
                    .withContext("active_connections", abandoned);
        }
    }

    private boolean awaitDrain(long deadline) throws InterruptedException {
        drainLock.lock();
        try {
            while (connections.get() > 0) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                drained.awaitNanos(remaining);
            }
            return true;
        } finally {
            drainLock.unlock();
        }
    }

    private void awaitShutdownInProgress(long deadline) throws TSDBException {
        try {
            final long remaining = Math.max(0, deadline - System.nanoTime());
            if (terminated.await(remaining, TimeUnit.NANOSECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        throw TSDBException.timeout("timed out waiting for shutdown in progress");
    }

    private void awaitTerminationUninterruptibly() {
        boolean interrupted = false;
        while (true) {
            try {
                terminated.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void stopListener() {
        collector.shutdownNow();
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_STOP_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void closeStorage() {
        if (storage == null) {
            return;
        }
        try {
            storage.close();
        } catch (IOException e) {
            log.error("Storage close error", e);
            metrics.increment(MetricNames.SERVER_ERRORS, "close_error", "storage");
        }
        metrics.set(MetricNames.STORAGE_CONNECTION_STATUS, 0);
    }

    @Override
    public boolean isAcceptingRequests() {
        return status.get() == ServerStatus.RUNNING;
    }

    @Override
    public void incrementConnection() {
        metrics.set(MetricNames.SERVER_ACTIVE_CONNECTIONS, connections.incrementAndGet());
    }

    @Override
    public void decrementConnection() {
        final long count = connections.updateAndGet(c -> c > 0 ? c - 1 : 0);
        metrics.set(MetricNames.SERVER_ACTIVE_CONNECTIONS, count);
        if (count == 0) {
            drainLock.lock();
            try {
                drained.signalAll();
            } finally {
                drainLock.unlock();
            }
        }
    }

    public long getActiveConnections() {
        return connections.get();
    }

    /**
     * Readiness flag, independent of the lifecycle status.
     */
    public void setHealth(boolean healthy) {
        this.healthy.set(healthy);
        metrics.set(MetricNames.SERVER_HEALTH, healthy ? 1 : 0);
    }

    public boolean isHealthy() {
        return healthy.get();
    }

    @NotNull
    public ServerStatus getStatus() {
        return status.get();
    }

    @NotNull
    public Instant getStartTime() {
        return startTime;
    }

    /**
     * @return the bound port once started, the configured one before
     */
    public int getPort() {
        final InetSocketAddress address = server.getAddress();
        return address == null ? config.getServer().getPort() : address.getPort();
    }

    @NotNull
    public Map<String, Object> getMetrics() {
        final Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", status.get().getCode());
        snapshot.put("uptime_seconds", uptimeSeconds());
        snapshot.put("start_time", startTime);
        snapshot.put("port", getPort());
        snapshot.put("threads", ManagementFactory.getThreadMXBean().getThreadCount());
        snapshot.put("storage_connected", storage != null && status.get() != ServerStatus.STOPPED);
        snapshot.put("active_connections", connections.get());
        snapshot.put("healthy", healthy.get());
        return snapshot;
    }

    private void initializeMetrics() {
        final ServerConfig server = config.getServer();
        metrics.set(MetricNames.SERVER_CONFIG_PORT, server.getPort());
        metrics.set(MetricNames.SERVER_CONFIG_READ_TIMEOUT, server.getReadTimeout().getSeconds());
        metrics.set(MetricNames.SERVER_CONFIG_WRITE_TIMEOUT, server.getWriteTimeout().getSeconds());
        metrics.set(MetricNames.SERVER_CONFIG_IDLE_TIMEOUT, server.getIdleTimeout().getSeconds());

        publishStatus();
        metrics.set(MetricNames.SERVER_START_TIME, startTime.getEpochSecond());
        metrics.set(MetricNames.STORAGE_CONNECTION_STATUS, storage == null ? 0 : 1);
        metrics.set(MetricNames.SERVER_HEALTH, 1);
    }

    private void collectMetrics() {
        try {
            final Runtime runtime = Runtime.getRuntime();
            metrics.set(MetricNames.SERVER_UPTIME, uptimeSeconds());
            metrics.set(MetricNames.SERVER_MEMORY_USAGE, runtime.totalMemory() - runtime.freeMemory());
            metrics.set(MetricNames.SERVER_THREADS, ManagementFactory.getThreadMXBean().getThreadCount());
        } catch (RuntimeException e) {
            log.warn("Failed to collect runtime metrics", e);
        }
    }

    private void publishStatus() {
        metrics.set(MetricNames.SERVER_STATUS, status.get().getCode());
    }

    private double uptimeSeconds() {
        return Duration.between(startTime, Instant.now()).toMillis() / 1000.0;
    }

    private static long toWaitNanos(@NotNull Duration timeout) {
        if (timeout.isNegative()) {
            return 0;
        }
        if (timeout.getSeconds() >= MAX_WAIT_NANOS / 1_000_000_000L) {
            return MAX_WAIT_NANOS;
        }
        return timeout.toNanos();
    }

    @NotNull
    private static ThreadFactory threads(@NotNull String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return r -> {
            final Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
