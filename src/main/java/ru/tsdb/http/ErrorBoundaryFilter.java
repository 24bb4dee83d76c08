package ru.tsdb.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tsdb.metrics.MetricNames;
import ru.tsdb.metrics.MetricsRecorder;

import java.io.IOException;

/**
 * Last line of defence: an unexpected failure of a handler is logged with its stack trace and
 * answered with a {@code 500} JSON error instead of dropping the connection.
 */
public class ErrorBoundaryFilter extends Filter {

    private static final Logger log = LoggerFactory.getLogger(ErrorBoundaryFilter.class);

    @NotNull
    private final MetricsRecorder metrics;

    public ErrorBoundaryFilter(@NotNull MetricsRecorder metrics) {
        this.metrics = metrics;
    }

    @Override
    public void doFilter(HttpExchange http, Chain chain) throws IOException {
        try {
            chain.doFilter(http);
        } catch (RuntimeException e) {
            log.error("Unhandled failure in {} {}", http.getRequestMethod(), http.getRequestURI(), e);
            metrics.increment(MetricNames.SERVER_ERRORS, "unhandled", http.getHttpContext().getPath());
            if (Exchanges.isCommitted(http)) {
                http.close();
            } else {
                ErrorResponses.sendInternal(http);
            }
        }
    }

    @Override
    public String description() {
        return "Converts unhandled failures into 500 responses";
    }
}
