package ru.tsdb.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.tsdb.errors.TSDBException;

import java.io.IOException;

import static ru.tsdb.http.Response.NOT_ALLOWED;

/**
 * Handler of one exact path. A {@link TSDBException} escaping {@link #process(HttpExchange)}
 * is answered with its JSON error body.
 */
abstract class BaseHandler implements HttpHandler {

    private static final String METHOD_IS_NOT_ALLOWED = "Method is not allowed";

    @Override
    public final void handle(@NotNull HttpExchange http) throws IOException {
        try {
            final String path = http.getRequestURI().getPath();
            if (!http.getHttpContext().getPath().equals(path)) {
                throw TSDBException.notFound("no such endpoint: " + path);
            }
            process(http);
        } catch (TSDBException e) {
            ErrorResponses.send(http, e);
        }
    }

    protected abstract void process(@NotNull HttpExchange http) throws IOException, TSDBException;

    protected void methodNotAllowed(@NotNull HttpExchange http,
                                    @NotNull HttpMethod allowed) throws IOException {
        http.getResponseHeaders().set("Allow", allowed.name());
        Exchanges.sendResponse(http, new Response(NOT_ALLOWED, METHOD_IS_NOT_ALLOWED));
    }

    @Nullable
    protected static HttpMethod methodOf(@NotNull HttpExchange http) {
        try {
            return HttpMethod.valueOf(http.getRequestMethod());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    enum HttpMethod {

        GET,
        HEAD,
        POST,
        PUT,
        DELETE

    }
}
