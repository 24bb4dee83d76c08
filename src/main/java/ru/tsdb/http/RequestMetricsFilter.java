package ru.tsdb.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;
import ru.tsdb.metrics.MetricNames;
import ru.tsdb.metrics.MetricsRecorder;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records request count, duration and in-flight requests, labelled by method and endpoint.
 */
public class RequestMetricsFilter extends Filter {

    @NotNull
    private final MetricsRecorder metrics;
    @NotNull
    private final AtomicInteger inFlight;

    /**
     * @param inFlight shared by the filters of all endpoints
     */
    public RequestMetricsFilter(@NotNull MetricsRecorder metrics, @NotNull AtomicInteger inFlight) {
        this.metrics = metrics;
        this.inFlight = inFlight;
    }

    @Override
    public void doFilter(HttpExchange http, Chain chain) throws IOException {
        final long start = System.nanoTime();
        metrics.set(MetricNames.HTTP_REQUESTS_IN_FLIGHT, inFlight.incrementAndGet());
        try {
            chain.doFilter(http);
        } finally {
            metrics.set(MetricNames.HTTP_REQUESTS_IN_FLIGHT, inFlight.decrementAndGet());
            final String method = http.getRequestMethod();
            final String path = http.getHttpContext().getPath();
            final String status = Integer.toString(http.getResponseCode());
            metrics.increment(MetricNames.HTTP_REQUESTS, method, path, status);
            metrics.observe(MetricNames.HTTP_REQUEST_DURATION, (System.nanoTime() - start) / 1e9, method, path);
        }
    }

    @Override
    public String description() {
        return "Records HTTP request metrics";
    }
}
