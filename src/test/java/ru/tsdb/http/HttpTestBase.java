package ru.tsdb.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpResponse;
import org.apache.http.client.fluent.Request;
import org.apache.http.entity.ContentType;
import org.apache.http.util.EntityUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.tsdb.TestBase;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.metrics.MetricsRecorder;
import ru.tsdb.server.TSDBServer;
import ru.tsdb.storage.Storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Facilities for tests talking to a running server over HTTP
 */
abstract class HttpTestBase extends TestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    int port;
    Path data;
    TSDBServer server;

    void startServer(@Nullable final Storage storage,
                     @NotNull final MetricsRecorder metrics) throws IOException, TSDBException {
        port = randomPort();
        data = createTempDirectory();
        server = new TSDBServer(config(port, data), storage, metrics);
        server.start();
    }

    void startServer(@NotNull final MetricsRecorder metrics) throws IOException, TSDBException {
        port = randomPort();
        data = createTempDirectory();
        server = TSDBServer.create(config(port, data), metrics);
        server.start();
    }

    void stopServer() throws IOException {
        if (server != null) {
            server.close();
        }
        if (data != null) {
            recursiveDelete(data);
        }
    }

    @NotNull
    private String url(@NotNull final String path) {
        return endpoint(port) + path;
    }

    HttpResponse get(@NotNull final String path) throws IOException {
        return Request.Get(url(path)).execute().returnResponse();
    }

    HttpResponse delete(@NotNull final String path) throws IOException {
        return Request.Delete(url(path)).execute().returnResponse();
    }

    HttpResponse write(@NotNull final String body) throws IOException {
        return Request.Post(url(Router.URL_WRITE))
                .bodyString(body, ContentType.create("text/plain", StandardCharsets.UTF_8))
                .execute()
                .returnResponse();
    }

    static int status(@NotNull final HttpResponse response) {
        return response.getStatusLine().getStatusCode();
    }

    @NotNull
    static String body(@NotNull final HttpResponse response) throws IOException {
        return EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
    }

    @NotNull
    static JsonNode json(@NotNull final HttpResponse response) throws IOException {
        return MAPPER.readTree(body(response));
    }
}
