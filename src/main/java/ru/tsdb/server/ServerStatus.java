package ru.tsdb.server;

/**
 * Lifecycle state of a {@link TSDBServer}.
 * <p>
 * A server moves forward only: {@code STARTING -> RUNNING -> SHUTTING_DOWN -> STOPPED},
 * shutdown may also begin straight from {@code STARTING}. The code is the value published
 * on the status gauge.
 */
public enum ServerStatus {

    STARTING(1),
    RUNNING(2),
    SHUTTING_DOWN(3),
    STOPPED(4);

    private final int code;

    ServerStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
