package ru.tsdb;

import org.jetbrains.annotations.Nullable;
import ru.tsdb.errors.TSDBException;

import java.io.Closeable;
import java.time.Duration;

/**
 * A time-series ingestion service with HTTP API persisting points to an append-only file.
 * <p>
 * The following HTTP protocol is supported:
 * <ul>
 * <li>{@code POST /write} -- body of one or more line protocol lines. Returns {@code 200} if every point
 * was stored, {@code 400} if the body is malformed or {@code 503} if the storage failed.</li>
 * <li>{@code GET /health} -- returns {@code 200} while the service exists.</li>
 * <li>{@code GET /metrics} -- returns the metrics in the Prometheus text format.</li>
 * </ul>
 * <p>
 * Line protocol: {@code measurement[,tag=value...] field=value[,field=value...] timestamp},
 * the timestamp is nanoseconds since the Unix epoch. A body is accepted or rejected as a whole.
 * <p>
 * Methods other than the listed ones return {@code 405}, unknown paths return {@code 404}.
 * Errors are answered with a JSON body {@code {"error", "type", "code", "message", "context"}}.
 */
public interface TSDBService extends Closeable {
    /**
     * Bind to the HTTP port and start listening.
     * <p>
     * May be called only once.
     *
     * @throws TSDBException if the port cannot be bound
     */
    void start() throws TSDBException;

    /**
     * Block until the service is stopped.
     */
    void awaitTermination() throws InterruptedException;

    /**
     * Start the service and block until it is stopped.
     */
    default void run() throws TSDBException, InterruptedException {
        start();
        awaitTermination();
    }

    /**
     * Stop accepting requests, wait for the ones in progress to finish and free all the resources.
     * <p>
     * Resources are freed even if the requests do not finish in time. Safe to call repeatedly and
     * concurrently, only the first call performs the shutdown.
     *
     * @param timeout how long to wait for requests in progress
     * @throws TSDBException of kind validation if {@code timeout} is {@code null},
     *                       of kind timeout if requests were still running when it expired
     */
    void shutdown(@Nullable Duration timeout) throws TSDBException;

    /**
     * Shut down at once without waiting for requests in progress, then free all the resources.
     * Never blocks on a stuck request. Safe to call repeatedly.
     */
    @Override
    void close();
}
