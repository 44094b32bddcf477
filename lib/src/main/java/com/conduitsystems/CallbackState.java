package com.conduitsystems;

/**
 * Lifecycle state of a {@link ThreadedCallback}.
 * <p>
 * {@code RUNNING} and {@code PAUSED} alternate around a fork;
 * {@code SHUTDOWN} is terminal.
 */
public enum CallbackState {
    /** Delivering queued invocations, or waiting for more. */
    RUNNING,

    /** Worker stopped ahead of a fork; the queue is retained. */
    PAUSED,

    /** Terminal. No worker will deliver the queue again. */
    SHUTDOWN
}
