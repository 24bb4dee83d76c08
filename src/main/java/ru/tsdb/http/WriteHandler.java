package ru.tsdb.http;

import com.sun.net.httpserver.HttpExchange;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tsdb.errors.ErrorType;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.metrics.MetricNames;
import ru.tsdb.metrics.MetricsRecorder;
import ru.tsdb.parser.LineProtocolParser;
import ru.tsdb.point.Point;
import ru.tsdb.storage.Storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static ru.tsdb.http.Response.OK;

/**
 * {@code POST /write}: parses the line protocol body and appends every point to the storage.
 * <p>
 * The first storage failure aborts the remaining points of the request.
 */
public class WriteHandler extends BaseHandler {

    private static final Logger log = LoggerFactory.getLogger(WriteHandler.class);

    private static final String OK_BODY = "OK";

    @NotNull
    private final LineProtocolParser parser;
    @Nullable
    private final Storage storage;
    @NotNull
    private final MetricsRecorder metrics;

    public WriteHandler(@NotNull LineProtocolParser parser,
                        @Nullable Storage storage,
                        @NotNull MetricsRecorder metrics) {
        this.parser = parser;
        this.storage = storage;
        this.metrics = metrics;
    }

    @Override
    protected void process(@NotNull HttpExchange http) throws IOException, TSDBException {
        if (methodOf(http) != HttpMethod.POST) {
            methodNotAllowed(http, HttpMethod.POST);
            return;
        }

        final long start = System.nanoTime();
        final byte[] body = Exchanges.readData(http.getRequestBody());
        if (body.length == 0) {
            throw TSDBException.validation("empty request body");
        }

        final List<Point> points = parser.parse(new String(body, StandardCharsets.UTF_8));
        metrics.increment(MetricNames.INGESTED_BATCHES);

        write(points);

        metrics.observe(MetricNames.INGESTION_LATENCY, (System.nanoTime() - start) / 1e9);
        log.debug("Wrote {} points", points.size());
        Exchanges.sendResponse(http, new Response(OK, OK_BODY));
    }

    private void write(@NotNull List<Point> points) throws TSDBException {
        if (storage == null) {
            throw TSDBException.storage("storage is not available");
        }
        int written = 0;
        for (Point point : points) {
            metrics.increment(MetricNames.INGESTED_POINTS);
            try {
                storage.writePoint(point);
            } catch (IOException e) {
                metrics.increment(MetricNames.WRITE_ERRORS);
                throw TSDBException.wrap(e, ErrorType.STORAGE, "failed to write point to storage")
                        .withContext("measurement", point.getMeasurement())
                        .withContext("written", written)
                        .withContext("total", points.size());
            }
            metrics.increment(MetricNames.POINTS_WRITTEN);
            written++;
        }
    }
}
