package ru.tsdb.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tsdb.errors.ErrorType;
import ru.tsdb.errors.TSDBException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static ru.tsdb.http.Response.*;

/**
 * Turns errors into JSON answers: {@code {"error", "type", "code", "message", "context"}}.
 */
final class ErrorResponses {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

    private ErrorResponses() {
        // Not instantiable
    }

    static int statusFor(@NotNull ErrorType type) {
        switch (type) {
            case VALIDATION:
                return BAD_REQUEST;
            case NOT_FOUND:
                return Response.NOT_FOUND;
            case DATABASE:
            case STORAGE:
                return SERVICE_UNAVAILABLE;
            case NETWORK:
                return BAD_GATEWAY;
            case TIMEOUT:
                return REQUEST_TIMEOUT;
            case INTERNAL:
            default:
                return SERVER_ERROR;
        }
    }

    static void send(@NotNull HttpExchange http, @NotNull TSDBException e) throws IOException {
        final int status = statusFor(e.getType());
        if (status >= SERVER_ERROR) {
            log.error("{} {} failed [{}]: {}", http.getRequestMethod(), http.getRequestURI(), e.getType(),
                    e.getMessage(), e);
        } else {
            log.warn("{} {} rejected [{}]: {}", http.getRequestMethod(), http.getRequestURI(), e.getType(),
                    e.getMessage());
        }
        send(http, status, e.getType().getCode(), e.getMessage(), e.getContext());
    }

    static void sendInternal(@NotNull HttpExchange http) throws IOException {
        send(http, SERVER_ERROR, ErrorType.INTERNAL.getCode(), INTERNAL_SERVER_ERROR, null);
    }

    static void send(@NotNull HttpExchange http,
                     int status,
                     @NotNull String type,
                     @NotNull String message,
                     @Nullable Map<String, Object> context) throws IOException {
        final ErrorResponse body = new ErrorResponse(type, status, message, context);
        Response resp;
        try {
            resp = new Response(status, JsonSupport.toBytes(body), APPLICATION_JSON);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode error response", e);
            resp = new Response(SERVER_ERROR, INTERNAL_SERVER_ERROR.getBytes(StandardCharsets.UTF_8), TEXT_PLAIN);
        }
        Exchanges.sendResponse(http, resp);
    }
}
