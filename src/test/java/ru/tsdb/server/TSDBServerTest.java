package ru.tsdb.server;

import org.jetbrains.annotations.NotNull;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import ru.tsdb.TestBase;
import ru.tsdb.config.TSDBConfig;
import ru.tsdb.errors.ErrorType;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.metrics.MetricNames;
import ru.tsdb.metrics.RecordingMetrics;
import ru.tsdb.point.Point;
import ru.tsdb.storage.Storage;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Lifecycle tests for {@link TSDBServer}
 */
public class TSDBServerTest extends TestBase {
    @Rule
    public final Timeout globalTimeout = Timeout.seconds(10);

    private Path data;
    private RecordingMetrics metrics;
    private CountingStorage storage;
    private TSDBServer server;

    @Before
    public void beforeEach() throws IOException, TSDBException {
        data = createTempDirectory();
        metrics = new RecordingMetrics();
        storage = new CountingStorage();
        server = new TSDBServer(config(randomPort(), data), storage, metrics);
    }

    @After
    public void afterEach() throws IOException {
        server.close();
        recursiveDelete(data);
    }

    @Test
    public void statusCodes() {
        assertEquals(1, ServerStatus.STARTING.getCode());
        assertEquals(2, ServerStatus.RUNNING.getCode());
        assertEquals(3, ServerStatus.SHUTTING_DOWN.getCode());
        assertEquals(4, ServerStatus.STOPPED.getCode());
    }

    @Test
    public void lifecycle() throws TSDBException {
        assertEquals(ServerStatus.STARTING, server.getStatus());
        assertEquals(1, metrics.countSet(MetricNames.SERVER_STATUS, 1));
        assertEquals(1, metrics.countSet(MetricNames.STORAGE_CONNECTION_STATUS, 1));

        server.start();
        assertEquals(ServerStatus.RUNNING, server.getStatus());
        assertEquals(1, metrics.countSet(MetricNames.SERVER_STATUS, 2));

        server.shutdown(Duration.ofSeconds(1));
        assertEquals(ServerStatus.STOPPED, server.getStatus());
        assertEquals(1, metrics.countSet(MetricNames.SERVER_STATUS, 3));
        assertEquals(1, metrics.countSet(MetricNames.SERVER_STATUS, 4));
        assertEquals(1, metrics.countSet(MetricNames.STORAGE_CONNECTION_STATUS, 0));
        assertEquals(1, metrics.count(MetricNames.SERVER_SHUTDOWN_DURATION));
        assertEquals(1, storage.closes.get());
    }

    @Test
    public void createOpensFileStorage() throws Exception {
        final TSDBServer created = TSDBServer.create(config(0, data), metrics);
        try {
            created.start();
            assertTrue(created.getPort() > 0);
            assertEquals(ServerStatus.RUNNING, created.getStatus());
        } finally {
            created.close();
        }
        assertTrue(data.resolve("data.tsv").toFile().exists());
    }

    @Test
    public void nullConfig() {
        try {
            TSDBServer.create(null, metrics);
            fail();
        } catch (TSDBException e) {
            assertEquals(ErrorType.VALIDATION, e.getType());
            assertEquals("config cannot be null", e.getMessage());
        }
    }

    @Test
    public void invalidConfig() {
        final TSDBConfig config = TSDBConfig.fromEnvironment(
                Collections.singletonMap("LOG_FORMAT", "xml"));
        try {
            new TSDBServer(config, null, metrics);
            fail();
        } catch (TSDBException e) {
            assertEquals(ErrorType.VALIDATION, e.getType());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void startTwice() throws TSDBException {
        server.start();
        server.start();
    }

    @Test(expected = IllegalStateException.class)
    public void startAfterShutdown() throws TSDBException {
        server.shutdown(Duration.ofSeconds(1));
        server.start();
    }

    @Test
    public void portInUse() throws IOException, TSDBException {
        try (ServerSocket occupied = new ServerSocket(0)) {
            final TSDBServer other = new TSDBServer(config(occupied.getLocalPort(), data), null, metrics);
            try {
                other.start();
                fail("Bind must fail");
            } catch (TSDBException e) {
                assertEquals(ErrorType.NETWORK, e.getType());
                assertEquals(occupied.getLocalPort(), e.getContext().get("port"));
            } finally {
                other.close();
            }
            assertEquals(ServerStatus.STOPPED, other.getStatus());
        }
    }

    @Test
    public void shutdownWithoutTimeout() throws TSDBException {
        server.start();
        try {
            server.shutdown(null);
            fail();
        } catch (TSDBException e) {
            assertEquals(ErrorType.VALIDATION, e.getType());
        }
        assertEquals(ServerStatus.RUNNING, server.getStatus());
        assertEquals(0, metrics.countSet(MetricNames.SERVER_STATUS, 3));
        assertEquals(0, storage.closes.get());
    }

    @Test
    public void shutdownBeforeStart() throws TSDBException {
        server.shutdown(Duration.ofSeconds(1));
        assertEquals(ServerStatus.STOPPED, server.getStatus());
        assertEquals(1, storage.closes.get());
    }

    @Test
    public void concurrentShutdown() throws Exception {
        server.start();
        final int callers = 5;
        final CountDownLatch go = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            final List<Future<Void>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit((Callable<Void>) () -> {
                    go.await();
                    server.shutdown(Duration.ofSeconds(5));
                    return null;
                }));
            }
            go.countDown();
            for (Future<Void> result : results) {
                result.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(ServerStatus.STOPPED, server.getStatus());
        assertEquals(1, metrics.countSet(MetricNames.SERVER_STATUS, 4));
        assertEquals(1, storage.closes.get());
    }

    @Test
    public void closeIsIdempotent() throws TSDBException {
        final TSDBServer bare = new TSDBServer(config(0, data), null, metrics);
        bare.close();
        bare.close();
        assertEquals(ServerStatus.STOPPED, bare.getStatus());
        assertEquals(1, metrics.countSet(MetricNames.SERVER_STATUS, 4));
    }

    @Test
    public void awaitTermination() throws Exception {
        server.start();
        final Thread waiter = new Thread(() -> {
            try {
                server.awaitTermination();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        server.shutdown(Duration.ofSeconds(1));
        waiter.join();
        assertFalse(waiter.isAlive());
    }

    @Test
    public void connectionCountNeverNegative() {
        server.decrementConnection();
        assertEquals(0, server.getActiveConnections());
        server.incrementConnection();
        server.incrementConnection();
        server.decrementConnection();
        assertEquals(1, server.getActiveConnections());
        server.decrementConnection();
        server.decrementConnection();
        assertEquals(0, server.getActiveConnections());
    }

    @Test
    public void acceptsOnlyWhileRunning() throws TSDBException {
        assertFalse(server.isAcceptingRequests());
        server.start();
        assertTrue(server.isAcceptingRequests());
        server.shutdown(Duration.ofSeconds(1));
        assertFalse(server.isAcceptingRequests());
    }

    @Test
    public void health() {
        assertTrue(server.isHealthy());
        server.setHealth(false);
        assertFalse(server.isHealthy());
        assertEquals(1, metrics.countSet(MetricNames.SERVER_HEALTH, 0));
        assertEquals(false, server.getMetrics().get("healthy"));
    }

    @Test
    public void metricsSnapshot() throws TSDBException {
        server.start();
        final Map<String, Object> snapshot = server.getMetrics();
        assertEquals(2, snapshot.get("status"));
        assertEquals(server.getPort(), snapshot.get("port"));
        assertEquals(true, snapshot.get("storage_connected"));
        assertEquals(0L, snapshot.get("active_connections"));
        assertTrue(snapshot.containsKey("uptime_seconds"));
        assertTrue(snapshot.containsKey("start_time"));
        assertTrue(snapshot.containsKey("threads"));
    }

    @Test
    public void storageCloseFailureStillStops() throws TSDBException {
        final TSDBServer failing = new TSDBServer(config(0, data), new Storage() {
            @Override
            public void writePoint(@NotNull final Point point) {
                // Accepts everything
            }

            @Override
            public void close() throws IOException {
                throw new IOException("Input/output error");
            }
        }, metrics);
        failing.start();
        failing.shutdown(Duration.ofSeconds(1));

        assertEquals(ServerStatus.STOPPED, failing.getStatus());
        assertEquals(1, metrics.countIncrements(MetricNames.SERVER_ERRORS, "close_error", "storage"));
        assertEquals(1, metrics.countSet(MetricNames.STORAGE_CONNECTION_STATUS, 0));
    }

    @Test
    public void shutdownWhileStarting() throws TSDBException {
        final ShutdownOnRunning recording = new ShutdownOnRunning();
        final TSDBServer racing = new TSDBServer(config(0, data), storage, recording);
        recording.server = racing;

        racing.start();

        assertEquals(ServerStatus.STOPPED, racing.getStatus());
        assertEquals(1, recording.countSet(MetricNames.SERVER_STATUS, 4));
        assertEquals(1, storage.closes.get());
    }

    /**
     * Shuts the server down from inside {@code start()}, right after it reports running.
     */
    private static final class ShutdownOnRunning extends RecordingMetrics {
        volatile TSDBServer server;

        @Override
        public synchronized void set(@NotNull final String name, final double value,
                                     @NotNull final String... labelValues) {
            super.set(name, value, labelValues);
            if (server != null && MetricNames.SERVER_STATUS.equals(name)
                    && value == ServerStatus.RUNNING.getCode()) {
                try {
                    server.shutdown(Duration.ofSeconds(1));
                } catch (TSDBException e) {
                    throw new AssertionError(e);
                }
            }
        }
    }

    private static final class CountingStorage implements Storage {
        final AtomicInteger closes = new AtomicInteger();

        @Override
        public void writePoint(@NotNull final Point point) {
            // Accepts everything
        }

        @Override
        public void close() {
            closes.incrementAndGet();
        }
    }
}
