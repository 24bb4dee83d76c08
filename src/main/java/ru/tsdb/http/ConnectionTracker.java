package ru.tsdb.http;

/**
 * Counts requests in progress and decides whether new ones are admitted.
 */
public interface ConnectionTracker {

    boolean isAcceptingRequests();

    void incrementConnection();

    /**
     * Never takes the count below zero.
     */
    void decrementConnection();

}
