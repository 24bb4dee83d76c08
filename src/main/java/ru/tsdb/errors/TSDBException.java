package ru.tsdb.errors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application error with a {@link ErrorType kind}, an optional cause and optional structured context.
 * <p>
 * Parser and storage failures are raised with a specific kind and travel unchanged up to the HTTP
 * layer, which maps the kind to a status code. The stack trace captured by the JVM at construction
 * is the diagnostic call-stack snapshot.
 */
public class TSDBException extends Exception {

    private static final long serialVersionUID = 1L;

    @NotNull
    private final ErrorType type;
    @NotNull
    private final String reason;
    @NotNull
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final long timestamp;

    public TSDBException(@NotNull ErrorType type, @NotNull String reason) {
        this(type, reason, null);
    }

    public TSDBException(@NotNull ErrorType type,
                         @NotNull String reason,
                         @Nullable Throwable cause) {
        super(reason, cause);
        this.type = type;
        this.reason = reason;
        this.timestamp = nowNanos();
    }

    @NotNull
    public ErrorType getType() {
        return type;
    }

    /**
     * @return the message without the cause appended
     */
    @NotNull
    public String getReason() {
        return reason;
    }

    /**
     * @return {@code reason: cause message} when there is a cause, the reason otherwise
     */
    @Override
    public String getMessage() {
        final Throwable cause = getCause();
        if (cause == null) {
            return reason;
        }
        return reason + ": " + cause.getMessage();
    }

    @NotNull
    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Creation time in nanoseconds since the Unix epoch.
     */
    public long getTimestamp() {
        return timestamp;
    }

    @NotNull
    public TSDBException withContext(@NotNull String key, @Nullable Object value) {
        context.put(key, value);
        return this;
    }

    public boolean is(@NotNull ErrorType type) {
        return this.type == type;
    }

    @NotNull
    public static TSDBException validation(@NotNull String message) {
        return new TSDBException(ErrorType.VALIDATION, message);
    }

    @NotNull
    public static TSDBException notFound(@NotNull String message) {
        return new TSDBException(ErrorType.NOT_FOUND, message);
    }

    @NotNull
    public static TSDBException database(@NotNull String message) {
        return new TSDBException(ErrorType.DATABASE, message);
    }

    @NotNull
    public static TSDBException storage(@NotNull String message) {
        return new TSDBException(ErrorType.STORAGE, message);
    }

    @NotNull
    public static TSDBException network(@NotNull String message) {
        return new TSDBException(ErrorType.NETWORK, message);
    }

    @NotNull
    public static TSDBException internal(@NotNull String message) {
        return new TSDBException(ErrorType.INTERNAL, message);
    }

    @NotNull
    public static TSDBException timeout(@NotNull String message) {
        return new TSDBException(ErrorType.TIMEOUT, message);
    }

    /**
     * Wraps {@code error} with an additional message.
     * <p>
     * Wrapping a {@link TSDBException} keeps its cause, context and stack trace and prefixes
     * its reason; {@code type} replaces its kind when given. Any other throwable becomes the cause
     * of a new exception of kind {@code type}, or {@link ErrorType#INTERNAL} when none is given.
     */
    @NotNull
    public static TSDBException wrap(@NotNull Throwable error,
                                     @Nullable ErrorType type,
                                     @NotNull String message) {
        if (error instanceof TSDBException) {
            final TSDBException inner = (TSDBException) error;
            final TSDBException wrapped = new TSDBException(
                    type == null ? inner.type : type,
                    message + ": " + inner.reason,
                    inner.getCause());
            wrapped.context.putAll(inner.context);
            wrapped.setStackTrace(inner.getStackTrace());
            return wrapped;
        }
        return new TSDBException(type == null ? ErrorType.INTERNAL : type, message, error);
    }

    public static boolean isType(@Nullable Throwable error, @NotNull ErrorType type) {
        return error instanceof TSDBException && ((TSDBException) error).type == type;
    }

    private static long nowNanos() {
        final Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}
