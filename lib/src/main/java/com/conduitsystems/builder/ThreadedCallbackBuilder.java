package com.conduitsystems.builder;

import com.conduitsystems.Callback;
import com.conduitsystems.ThreadedCallback;
import com.conduitsystems.config.CallbackConfig;
import com.conduitsystems.fork.ForkHookRegistry;
import com.conduitsystems.handler.CallbackFailureHandler;

import java.time.Duration;
import java.util.Objects;

/**
 * Builder for creating threaded callbacks with a fluent API.
 *
 * @param <T> The type of payload delivered to the callback
 */
public class ThreadedCallbackBuilder<T> {

    private final Callback<T> callback;
    private CallbackConfig config;
    private CallbackFailureHandler<T> failureHandler;
    private ForkHookRegistry forkHooks;

    /**
     * Creates a new builder for the given callback.
     *
     * @param callback The callback to deliver payloads to
     */
    public ThreadedCallbackBuilder(Callback<T> callback) {
        this.callback = Objects.requireNonNull(callback, "callback cannot be null");
        this.config = new CallbackConfig();
        this.failureHandler = CallbackFailureHandler.ignore();
    }

    /**
     * Replaces the whole configuration. Later {@code with*} calls modify a copy of it.
     *
     * @param config The dispatcher configuration
     * @return This builder for method chaining
     */
    public ThreadedCallbackBuilder<T> withConfig(CallbackConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null").copy();
        return this;
    }

    /**
     * Sets the dispatcher name used in logs and worker thread names.
     *
     * @param name The dispatcher name
     * @return This builder for method chaining
     */
    public ThreadedCallbackBuilder<T> withName(String name) {
        config.setName(name);
        return this;
    }

    /**
     * Sets whether the worker runs on a daemon thread.
     *
     * @param daemon true for a daemon worker
     * @return This builder for method chaining
     */
    public ThreadedCallbackBuilder<T> withDaemon(boolean daemon) {
        config.setDaemon(daemon);
        return this;
    }

    /**
     * Sets the default timeout used by {@link ThreadedCallback#shutdown()}.
     *
     * @param shutdownTimeout The timeout
     * @return This builder for method chaining
     */
    public ThreadedCallbackBuilder<T> withShutdownTimeout(Duration shutdownTimeout) {
        config.setShutdownTimeout(shutdownTimeout);
        return this;
    }

    /**
     * Sets the handler notified of failed deliveries.
     *
     * @param failureHandler The failure handler
     * @return This builder for method chaining
     */
    public ThreadedCallbackBuilder<T> withFailureHandler(CallbackFailureHandler<T> failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler cannot be null");
        return this;
    }

    /**
     * Registers the started dispatcher with a fork-hook registry.
     *
     * @param forkHooks The registry to join
     * @return This builder for method chaining
     */
    public ThreadedCallbackBuilder<T> withForkHooks(ForkHookRegistry forkHooks) {
        this.forkHooks = Objects.requireNonNull(forkHooks, "forkHooks cannot be null");
        return this;
    }

    /**
     * Creates the dispatcher and starts its worker.
     *
     * @return the running dispatcher
     */
    public ThreadedCallback<T> start() {
        ThreadedCallback<T> threadedCallback = new ThreadedCallback<>(callback, config.copy(), failureHandler);
        if (forkHooks != null) {
            forkHooks.register(threadedCallback);
        }
        return threadedCallback;
    }
}
