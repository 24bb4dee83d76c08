package ru.tsdb.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.Predicate;
import io.prometheus.client.exporter.common.TextFormat;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

import static ru.tsdb.metrics.MetricNames.*;

/**
 * {@link MetricsRecorder} backed by a Prometheus {@link CollectorRegistry} owned by this instance.
 * <p>
 * Every metric is registered up front, recording an undeclared name is a programming error.
 */
public class PrometheusMetrics implements MetricsRecorder {

    private static final Predicate<String> EXPORTED_SAMPLES = sample -> !sample.endsWith("_created");

    @NotNull
    private final CollectorRegistry registry;

    private final Map<String, Counter> counters = new HashMap<>();
    private final Map<String, Histogram> histograms = new HashMap<>();
    private final Map<String, Gauge> gauges = new HashMap<>();

    public PrometheusMetrics() {
        this(new CollectorRegistry());
    }

    public PrometheusMetrics(@NotNull CollectorRegistry registry) {
        this.registry = registry;

        counter(INGESTED_POINTS, "Total number of points ingested");
        counter(INGESTED_BATCHES, "Total number of batches ingested");
        histogram(INGESTION_LATENCY, "Time taken to ingest points");
        counter(POINTS_WRITTEN, "Total number of data points written to storage");
        counter(WRITE_ERRORS, "Total number of failed point writes");

        counter(STORAGE_ROWS_WRITTEN, "Total number of rows appended to the data file");
        counter(STORAGE_ROTATIONS, "Total number of data file rotations");
        gauge(STORAGE_CONNECTION_STATUS, "Storage connection status (1=connected, 0=disconnected)");

        counter(HTTP_REQUESTS, "Total number of HTTP requests", "method", "path", "status_code");
        histogram(HTTP_REQUEST_DURATION, "HTTP request duration", "method", "path");
        gauge(HTTP_REQUESTS_IN_FLIGHT, "Number of HTTP requests being served");

        gauge(SERVER_STATUS, "Server status (1=starting, 2=running, 3=shutting_down, 4=stopped)");
        gauge(SERVER_HEALTH, "Server health (1=healthy, 0=unhealthy)");
        gauge(SERVER_START_TIME, "Server start time in seconds since the epoch");
        gauge(SERVER_UPTIME, "Server uptime in seconds");
        gauge(SERVER_ACTIVE_CONNECTIONS, "Number of active connections");
        histogram(SERVER_SHUTDOWN_DURATION, "Time taken to shut the server down");
        counter(SERVER_ERRORS, "Total number of server errors", "error_type", "component");
        gauge(SERVER_MEMORY_USAGE, "Heap memory in use in bytes");
        gauge(SERVER_THREADS, "Number of live threads");
        gauge(SERVER_CONFIG_PORT, "Configured server port");
        gauge(SERVER_CONFIG_READ_TIMEOUT, "Configured read timeout in seconds");
        gauge(SERVER_CONFIG_WRITE_TIMEOUT, "Configured write timeout in seconds");
        gauge(SERVER_CONFIG_IDLE_TIMEOUT, "Configured idle timeout in seconds");
    }

    @NotNull
    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void increment(@NotNull String name, @NotNull String... labelValues) {
        final Counter counter = lookup(counters, name);
        if (labelValues.length == 0) {
            counter.inc();
        } else {
            counter.labels(labelValues).inc();
        }
    }

    @Override
    public void observe(@NotNull String name, double value, @NotNull String... labelValues) {
        final Histogram histogram = lookup(histograms, name);
        if (labelValues.length == 0) {
            histogram.observe(value);
        } else {
            histogram.labels(labelValues).observe(value);
        }
    }

    @Override
    public void set(@NotNull String name, double value, @NotNull String... labelValues) {
        final Gauge gauge = lookup(gauges, name);
        if (labelValues.length == 0) {
            gauge.set(value);
        } else {
            gauge.labels(labelValues).set(value);
        }
    }

    @Override
    public void export(@NotNull Writer writer) throws IOException {
        TextFormat.write004(writer, registry.filteredMetricFamilySamples(EXPORTED_SAMPLES));
        writer.flush();
    }

    private void counter(@NotNull String name, @NotNull String help, @NotNull String... labels) {
        counters.put(name, Counter.build().name(name).help(help).labelNames(labels).register(registry));
    }

    private void histogram(@NotNull String name, @NotNull String help, @NotNull String... labels) {
        histograms.put(name, Histogram.build().name(name).help(help).labelNames(labels).register(registry));
    }

    private void gauge(@NotNull String name, @NotNull String help, @NotNull String... labels) {
        gauges.put(name, Gauge.build().name(name).help(help).labelNames(labels).register(registry));
    }

    @NotNull
    private static <T> T lookup(@NotNull Map<String, T> metrics, @NotNull String name) {
        final T metric = metrics.get(name);
        if (metric == null) {
            throw new IllegalArgumentException("Unknown metric: " + name);
        }
        return metric;
    }
}
