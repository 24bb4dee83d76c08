package ru.tsdb.http;

import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;
import ru.tsdb.errors.TSDBException;

/**
 * Catch-all for paths without an endpoint.
 */
public class NotFoundHandler extends BaseHandler {

    @Override
    protected void process(@NotNull HttpExchange http) throws TSDBException {
        throw TSDBException.notFound("no such endpoint: " + http.getRequestURI().getPath());
    }
}
