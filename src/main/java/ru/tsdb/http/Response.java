package ru.tsdb.http;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;

class Response {

    static final int OK = 200;
    static final int BAD_REQUEST = 400;
    static final int NOT_FOUND = 404;
    static final int NOT_ALLOWED = 405;
    static final int REQUEST_TIMEOUT = 408;
    static final int SERVER_ERROR = 500;
    static final int BAD_GATEWAY = 502;
    static final int SERVICE_UNAVAILABLE = 503;

    static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    static final String APPLICATION_JSON = "application/json";

    private final int code;
    @NotNull
    private final byte[] data;
    @NotNull
    private final String contentType;

    Response(int code, @NotNull String data) {
        this(code, data.getBytes(StandardCharsets.UTF_8), TEXT_PLAIN);
    }

    Response(int code, @NotNull byte[] data, @NotNull String contentType) {
        this.code = code;
        this.data = data;
        this.contentType = contentType;
    }

    int getCode() {
        return code;
    }

    @NotNull
    byte[] getData() {
        return data;
    }

    @NotNull
    String getContentType() {
        return contentType;
    }
}
