package ru.tsdb.http;

import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

final class Exchanges {

    private static final int BUFFER_SIZE = 1024;
    private static final int NO_BODY = -1;

    private Exchanges() {
        // Not instantiable
    }

    @NotNull
    static byte[] readData(@NotNull InputStream is) throws IOException {
        try (ByteArrayOutputStream os = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[BUFFER_SIZE];
            for (int len; (len = is.read(buffer, 0, BUFFER_SIZE)) != -1; ) {
                os.write(buffer, 0, len);
            }
            os.flush();
            return os.toByteArray();
        }
    }

    static void sendResponse(@NotNull HttpExchange http,
                             @NotNull Response resp) throws IOException {
        http.getResponseHeaders().set("Content-Type", resp.getContentType());
        final byte[] data = resp.getData();
        if (data.length > 0) {
            http.sendResponseHeaders(resp.getCode(), data.length);
            http.getResponseBody().write(data);
        } else {
            http.sendResponseHeaders(resp.getCode(), NO_BODY);
        }
        http.close();
    }

    /**
     * @return whether the status line has already been sent
     */
    static boolean isCommitted(@NotNull HttpExchange http) {
        return http.getResponseCode() != -1;
    }
}
