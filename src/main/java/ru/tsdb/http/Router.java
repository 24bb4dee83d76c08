package ru.tsdb.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.tsdb.metrics.MetricsRecorder;
import ru.tsdb.parser.LineProtocolParser;
import ru.tsdb.storage.Storage;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Binds the endpoints to an {@link HttpServer}.
 * <p>
 * Every endpoint runs behind, outermost first: connection tracking, request metrics,
 * the error boundary.
 */
public class Router {

    public static final String URL_WRITE = "/write";
    public static final String URL_HEALTH = "/health";
    public static final String URL_METRICS = "/metrics";
    private static final String URL_ROOT = "/";

    @NotNull
    private final WriteHandler writeHandler;
    @NotNull
    private final HealthHandler healthHandler;
    @NotNull
    private final MetricsHandler metricsHandler;
    @NotNull
    private final NotFoundHandler notFoundHandler = new NotFoundHandler();
    @NotNull
    private final ConnectionTracker tracker;
    @NotNull
    private final MetricsRecorder metrics;
    private final AtomicInteger inFlight = new AtomicInteger();

    public Router(@Nullable Storage storage,
                  @NotNull MetricsRecorder metrics,
                  @NotNull ConnectionTracker tracker,
                  @NotNull BooleanSupplier ready) {
        this.writeHandler = new WriteHandler(new LineProtocolParser(), storage, metrics);
        this.healthHandler = new HealthHandler(ready);
        this.metricsHandler = new MetricsHandler(metrics);
        this.tracker = tracker;
        this.metrics = metrics;
    }

    public void register(@NotNull HttpServer server) {
        route(server, URL_WRITE, writeHandler);
        route(server, URL_HEALTH, healthHandler);
        route(server, URL_METRICS, metricsHandler);
        route(server, URL_ROOT, notFoundHandler);
    }

    private void route(@NotNull HttpServer server,
                       @NotNull String path,
                       @NotNull HttpHandler handler) {
        final HttpContext context = server.createContext(path, handler);
        final List<Filter> filters = context.getFilters();
        filters.add(new ConnectionTrackingFilter(tracker));
        filters.add(new RequestMetricsFilter(metrics, inFlight));
        filters.add(new ErrorBoundaryFilter(metrics));
    }
}
