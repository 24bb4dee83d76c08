package ru.tsdb.http;

import com.sun.net.httpserver.HttpExchange;
import io.prometheus.client.exporter.common.TextFormat;
import org.jetbrains.annotations.NotNull;
import ru.tsdb.metrics.MetricsRecorder;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static ru.tsdb.http.Response.OK;

/**
 * {@code GET /metrics}: Prometheus text exposition of the recorder state.
 */
public class MetricsHandler extends BaseHandler {

    @NotNull
    private final MetricsRecorder metrics;

    public MetricsHandler(@NotNull MetricsRecorder metrics) {
        this.metrics = metrics;
    }

    @Override
    protected void process(@NotNull HttpExchange http) throws IOException {
        if (methodOf(http) != HttpMethod.GET) {
            methodNotAllowed(http, HttpMethod.GET);
            return;
        }
        final StringWriter text = new StringWriter();
        metrics.export(text);
        Exchanges.sendResponse(http,
                new Response(OK, text.toString().getBytes(StandardCharsets.UTF_8), TextFormat.CONTENT_TYPE_004));
    }
}
