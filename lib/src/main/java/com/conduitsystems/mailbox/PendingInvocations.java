package com.conduitsystems.mailbox;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Unbounded FIFO of pending invocations for a single dispatcher.
 * <p>
 * Not thread-safe. The owning dispatcher guards every access with its lock,
 * the same lock that guards its lifecycle state, so that "queue empty" and
 * "state changed" can be tested together before the worker waits.
 *
 * @param <T> The type of payloads
 */
public class PendingInvocations<T> {

    private final ArrayDeque<PendingInvocation<T>> queue = new ArrayDeque<>();
    private long nextSequence = 1;

    /**
     * Appends a payload at the tail.
     *
     * @param payload the payload to append
     * @return the appended invocation
     */
    public PendingInvocation<T> append(T payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        PendingInvocation<T> invocation = new PendingInvocation<>(nextSequence++, payload, System.nanoTime());
        queue.addLast(invocation);
        return invocation;
    }

    /**
     * Removes the head invocation.
     *
     * @return the oldest pending invocation, or null if empty
     */
    public PendingInvocation<T> shift() {
        return queue.pollFirst();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }
}
