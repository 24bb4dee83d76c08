package ru.tsdb.http;

import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static ru.tsdb.http.Response.APPLICATION_JSON;
import static ru.tsdb.http.Response.OK;

/**
 * {@code GET /health}: liveness, always {@code 200} while the server exists.
 * The {@code ready} flag reports the readiness signal.
 */
public class HealthHandler extends BaseHandler {

    private static final String SERVICE = "TimeSeriesDB";

    @NotNull
    private final BooleanSupplier ready;

    public HealthHandler(@NotNull BooleanSupplier ready) {
        this.ready = ready;
    }

    @Override
    protected void process(@NotNull HttpExchange http) throws IOException {
        if (methodOf(http) != HttpMethod.GET) {
            methodNotAllowed(http, HttpMethod.GET);
            return;
        }
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE);
        body.put("ready", ready.getAsBoolean());
        Exchanges.sendResponse(http, new Response(OK, JsonSupport.toBytes(body), APPLICATION_JSON));
    }
}
