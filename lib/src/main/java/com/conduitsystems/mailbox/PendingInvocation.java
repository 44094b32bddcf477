package com.conduitsystems.mailbox;

import java.util.Objects;

/**
 * An enqueued, not yet delivered payload.
 *
 * @param sequence        position in enqueue order, starting at 1
 * @param payload         the payload captured at enqueue time
 * @param enqueuedAtNanos {@link System#nanoTime()} when the payload was enqueued
 * @param <T> The type of payload
 */
public record PendingInvocation<T>(long sequence, T payload, long enqueuedAtNanos) {

    public PendingInvocation {
        Objects.requireNonNull(payload, "payload cannot be null");
    }

    /**
     * Nanoseconds this invocation has been waiting, relative to the given instant.
     *
     * @param nowNanos a {@link System#nanoTime()} reading
     * @return the time spent queued, in nanoseconds
     */
    public long queuedNanos(long nowNanos) {
        return nowNanos - enqueuedAtNanos;
    }
}
