package ru.tsdb.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;

import static ru.tsdb.http.Response.SERVICE_UNAVAILABLE;

/**
 * Outermost filter: every request is counted as an active connection for its whole duration,
 * requests arriving after shutdown began are refused with {@code 503}.
 */
public class ConnectionTrackingFilter extends Filter {

    private static final String UNAVAILABLE = "unavailable";
    private static final String SHUTTING_DOWN = "server is shutting down";

    @NotNull
    private final ConnectionTracker tracker;

    public ConnectionTrackingFilter(@NotNull ConnectionTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public void doFilter(HttpExchange http, Chain chain) throws IOException {
        // Counted before the check so that a drain in progress waits for this request
        tracker.incrementConnection();
        try {
            if (!tracker.isAcceptingRequests()) {
                http.getResponseHeaders().set("Connection", "close");
                ErrorResponses.send(http, SERVICE_UNAVAILABLE, UNAVAILABLE, SHUTTING_DOWN, null);
                return;
            }
            chain.doFilter(http);
        } finally {
            tracker.decrementConnection();
        }
    }

    @Override
    public String description() {
        return "Tracks active connections";
    }
}
