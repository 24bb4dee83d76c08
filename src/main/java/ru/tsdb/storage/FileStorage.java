package ru.tsdb.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tsdb.config.StorageConfig;
import ru.tsdb.metrics.MetricNames;
import ru.tsdb.metrics.MetricsRecorder;
import ru.tsdb.point.Point;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Map;
import java.util.StringJoiner;
import java.util.zip.GZIPOutputStream;

/**
 * {@link Storage} appending tab-separated rows to a single file:
 * <pre>
 * measurement \t tags \t field \t value \t timestamp
 * </pre>
 * Tags are {@code k=v} pairs joined by commas, values are plain decimals, timestamps are UTC
 * RFC 3339 with up to nine fractional digits.
 * <p>
 * When the file reaches the configured maximum size it is moved into the backup directory
 * (gzip-compressed if enabled) and a fresh file is started.
 */
public class FileStorage implements Storage {

    private static final Logger log = LoggerFactory.getLogger(FileStorage.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .appendLiteral('Z')
            .toFormatter()
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final String GZIP_EXTENSION = ".gz";

    private static final char DELIMITER = '\t';
    private static final char QUOTE = '"';

    @NotNull
    private final Path path;
    @NotNull
    private final StorageConfig config;
    @NotNull
    private final MetricsRecorder metrics;

    @NotNull
    private final Opener opener;

    @Nullable
    private OutputStream out;
    private boolean closed;

    public FileStorage(@NotNull StorageConfig config,
                       @NotNull MetricsRecorder metrics) throws IOException {
        this(config, metrics, FileStorage::openAppend);
    }

    FileStorage(@NotNull StorageConfig config,
                @NotNull MetricsRecorder metrics,
                @NotNull Opener opener) throws IOException {
        this.path = Paths.get(config.getDataFile());
        this.config = config;
        this.metrics = metrics;
        this.opener = opener;
        this.out = opener.open(path);
        log.info("Storage opened at {}", path.toAbsolutePath());
    }

    @NotNull
    public Path getPath() {
        return path;
    }

    /**
     * All rows of the point reach the file in a single unbuffered write. A failed write discards
     * the stream, the next call reopens the file.
     */
    @Override
    public synchronized void writePoint(@NotNull Point point) throws IOException {
        ensureOpen();
        rotateIfNeeded();

        final String tags = formatTags(point.getTags());
        final String timestamp = TIMESTAMP_FORMAT.format(point.getInstant());
        final StringBuilder rows = new StringBuilder();
        for (Map.Entry<String, Double> field : point.getFields().entrySet()) {
            appendRow(rows,
                    point.getMeasurement(),
                    tags,
                    field.getKey(),
                    Point.formatValue(field.getValue()),
                    timestamp);
        }

        final OutputStream stream = ensureOpen();
        try {
            stream.write(rows.toString().getBytes(StandardCharsets.UTF_8));
            stream.flush();
        } catch (IOException e) {
            discard(stream, e);
            throw e;
        }
        for (int i = 0; i < point.getFields().size(); i++) {
            metrics.increment(MetricNames.STORAGE_ROWS_WRITTEN);
        }
    }

    /**
     * Truncates the data file.
     */
    public synchronized void clear() throws IOException {
        closeStream(ensureOpen());
        try {
            Files.write(path, new byte[0]);
        } finally {
            out = opener.open(path);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (out != null) {
            closeStream(out);
            log.info("Storage closed at {}", path.toAbsolutePath());
        }
    }

    @NotNull
    private OutputStream ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("storage is closed");
        }
        if (out == null) {
            out = opener.open(path);
        }
        return out;
    }

    private void closeStream(@NotNull OutputStream stream) throws IOException {
        out = null;
        stream.close();
    }

    private void discard(@NotNull OutputStream stream, @NotNull IOException failure) {
        out = null;
        try {
            stream.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        log.warn("Write to {} failed, reopening on next write", path, failure);
    }

    private void rotateIfNeeded() throws IOException {
        final long maxFileSize = config.getMaxFileSize();
        if (maxFileSize <= 0 || Files.size(path) < maxFileSize) {
            return;
        }

        closeStream(ensureOpen());

        final Path backup;
        try {
            final Path backupDir = Paths.get(config.getBackupDir());
            Files.createDirectories(backupDir);
            backup = backupPath(backupDir);
            if (config.isCompression()) {
                compress(path, backup);
                Files.delete(path);
            } else {
                Files.move(path, backup);
            }
        } finally {
            out = opener.open(path);
        }

        metrics.increment(MetricNames.STORAGE_ROTATIONS);
        log.info("Storage file rotated: {} -> {}", path, backup);
    }

    @NotNull
    private Path backupPath(@NotNull Path backupDir) {
        final String base = path.getFileName() + "." + BACKUP_SUFFIX.format(LocalDateTime.now());
        final String extension = config.isCompression() ? GZIP_EXTENSION : "";
        Path backup = backupDir.resolve(base + extension);
        for (int i = 1; Files.exists(backup); i++) {
            backup = backupDir.resolve(base + "-" + i + extension);
        }
        return backup;
    }

    private static void compress(@NotNull Path source, @NotNull Path target) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
            in.transferTo(out);
        }
    }

    @NotNull
    private static OutputStream openAppend(@NotNull Path path) throws IOException {
        return Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    private static void appendRow(@NotNull StringBuilder rows, @NotNull String... cells) {
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                rows.append(DELIMITER);
            }
            rows.append(quote(cells[i]));
        }
        rows.append('\n');
    }

    @NotNull
    static String formatTags(@NotNull Map<String, String> tags) {
        final StringJoiner joiner = new StringJoiner(",");
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            joiner.add(tag.getKey() + "=" + tag.getValue());
        }
        return joiner.toString();
    }

    @NotNull
    static String quote(@NotNull String cell) {
        boolean needsQuotes = false;
        for (int i = 0; i < cell.length() && !needsQuotes; i++) {
            final char c = cell.charAt(i);
            needsQuotes = c == DELIMITER || c == QUOTE || c == '\r' || c == '\n';
        }
        if (!needsQuotes) {
            return cell;
        }
        return QUOTE + cell.replace("\"", "\"\"") + QUOTE;
    }

    /**
     * Opens the data file for appending.
     */
    interface Opener {
        @NotNull
        OutputStream open(@NotNull Path path) throws IOException;
    }
}
