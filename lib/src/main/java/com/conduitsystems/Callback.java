package com.conduitsystems;

/**
 * User-supplied behavior invoked by a {@link ThreadedCallback} worker thread.
 * <p>
 * The payload type is fixed per dispatcher. Callbacks taking several values
 * use a record as payload; callbacks taking none can be modelled as
 * {@code ThreadedCallback<Runnable>} with {@code Runnable::run}.
 *
 * @param <T> The type of payload delivered to the callback
 */
@FunctionalInterface
public interface Callback<T> {

    /**
     * Handles one delivered payload.
     * Any exception thrown here is caught and logged by the dispatcher;
     * it never reaches the thread that enqueued the payload.
     *
     * @param payload the payload captured at enqueue time
     * @throws Exception if the callback fails
     */
    void call(T payload) throws Exception;
}
