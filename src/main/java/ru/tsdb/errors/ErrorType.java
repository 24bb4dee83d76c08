package ru.tsdb.errors;

import org.jetbrains.annotations.NotNull;

/**
 * Kind of a {@link TSDBException}.
 * <p>
 * The kind decides how an error is reported to HTTP clients, the code is the wire name used
 * in JSON error bodies and metric labels.
 */
public enum ErrorType {

    VALIDATION("validation"),
    NOT_FOUND("not_found"),
    DATABASE("database"),
    STORAGE("storage"),
    NETWORK("network"),
    INTERNAL("internal"),
    TIMEOUT("timeout");

    @NotNull
    private final String code;

    ErrorType(@NotNull String code) {
        this.code = code;
    }

    @NotNull
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
