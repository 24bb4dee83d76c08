package ru.tsdb.metrics;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Writer;

/**
 * Sink for counters, histograms and gauges.
 * <p>
 * Metric names are the ones declared in {@link MetricNames}, label values are given in the order
 * of the metric's label names. Implementations must be safe for concurrent use from request threads.
 */
public interface MetricsRecorder {

    /**
     * Increments the named counter by one.
     */
    void increment(@NotNull String name, @NotNull String... labelValues);

    /**
     * Adds a sample to the named histogram.
     */
    void observe(@NotNull String name, double value, @NotNull String... labelValues);

    /**
     * Sets the named gauge.
     */
    void set(@NotNull String name, double value, @NotNull String... labelValues);

    /**
     * Writes the current state in the Prometheus text exposition format.
     * Recorders without state write nothing.
     */
    default void export(@NotNull Writer writer) throws IOException {
        // Nothing to export
    }

    /**
     * Recorder that ignores all updates.
     */
    MetricsRecorder NO_OP = new MetricsRecorder() {
        @Override
        public void increment(@NotNull String name, @NotNull String... labelValues) {
        }

        @Override
        public void observe(@NotNull String name, double value, @NotNull String... labelValues) {
        }

        @Override
        public void set(@NotNull String name, double value, @NotNull String... labelValues) {
        }
    };
}
