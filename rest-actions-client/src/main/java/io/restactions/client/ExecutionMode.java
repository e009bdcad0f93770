package io.restactions.client;

/**
 * How resource handles wait for responses. Fixed when the client is built.
 */
public enum ExecutionMode {
    /** Calls block the calling thread. */
    BLOCKING,
    /** Calls return futures. */
    ASYNC
}
