package com.conduitsystems.handler;

import com.conduitsystems.mailbox.PendingInvocation;

/**
 * Receives invocations whose callback threw.
 * <p>
 * Runs on the worker thread after the failure has been logged. Exceptions thrown
 * by the handler itself are logged and dropped; the worker keeps delivering.
 *
 * @param <T> The type of payloads
 */
@FunctionalInterface
public interface CallbackFailureHandler<T> {

    /**
     * Called once per failed delivery.
     *
     * @param invocation the invocation whose callback failed
     * @param error the failure raised by the callback
     */
    void onFailure(PendingInvocation<T> invocation, Throwable error);

    /**
     * A handler that does nothing beyond the dispatcher's own error log.
     *
     * @param <T> The type of payloads
     * @return a no-op handler
     */
    static <T> CallbackFailureHandler<T> ignore() {
        return (invocation, error) -> { };
    }
}
