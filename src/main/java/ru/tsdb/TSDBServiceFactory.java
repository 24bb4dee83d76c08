package ru.tsdb;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.tsdb.config.TSDBConfig;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.metrics.MetricsRecorder;
import ru.tsdb.metrics.PrometheusMetrics;
import ru.tsdb.server.TSDBServer;

/**
 * Constructs {@link TSDBService} instances.
 */
final class TSDBServiceFactory {

    private TSDBServiceFactory() {
        // Not supposed to be instantiated
    }

    /**
     * Construct a service with its own Prometheus registry.
     *
     * @param config service configuration, validated before anything is opened
     * @return a service instance which has not been started yet
     */
    @NotNull
    static TSDBService create(@Nullable TSDBConfig config) throws TSDBException {
        return create(config, new PrometheusMetrics());
    }

    @NotNull
    static TSDBService create(@Nullable TSDBConfig config,
                              @NotNull MetricsRecorder metrics) throws TSDBException {
        return TSDBServer.create(config, metrics);
    }
}
