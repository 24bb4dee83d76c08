package ru.tsdb.storage;

import org.jetbrains.annotations.NotNull;
import ru.tsdb.point.Point;

import java.io.Closeable;
import java.io.IOException;

/**
 * Append-only store of points.
 * <p>
 * Implementations are safe for concurrent writers: the rows of one {@link #writePoint(Point)}
 * call are never interleaved with rows of another.
 */
public interface Storage extends Closeable {

    /**
     * Appends one row per field of {@code point}, in field order.
     * The rows are flushed to the backing store when the method returns.
     *
     * @throws IOException if the append fails, the rows of this call may be partially written
     */
    void writePoint(@NotNull Point point) throws IOException;

    /**
     * Releases the backing store. Calling it again has no effect.
     */
    @Override
    void close() throws IOException;

}
