package com.conduitsystems.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a threaded callback dispatcher.
 */
public class CallbackConfig {
    // Default values for dispatcher configuration
    public static final String DEFAULT_NAME = "callback";
    public static final boolean DEFAULT_DAEMON = true;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private String name;
    private boolean daemon;
    private Duration shutdownTimeout;

    /**
     * Creates a new CallbackConfig with default values.
     */
    public CallbackConfig() {
        this.name = DEFAULT_NAME;
        this.daemon = DEFAULT_DAEMON;
        this.shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    }

    /**
     * Sets the dispatcher name, used in log messages and worker thread names.
     *
     * @param name The dispatcher name
     * @return This CallbackConfig instance
     */
    public CallbackConfig setName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.name = name;
        return this;
    }

    /**
     * Gets the dispatcher name.
     *
     * @return The dispatcher name
     */
    public String getName() {
        return name;
    }

    /**
     * Sets whether worker threads are daemon threads. Daemon workers do not keep
     * the JVM alive when a dispatcher is never shut down.
     *
     * @param daemon true for daemon worker threads
     * @return This CallbackConfig instance
     */
    public CallbackConfig setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    /**
     * Sets how long {@code shutdown()} waits for the worker to exit.
     *
     * @param shutdownTimeout The timeout (must be positive)
     * @return This CallbackConfig instance
     */
    public CallbackConfig setShutdownTimeout(Duration shutdownTimeout) {
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout cannot be null");
        if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            throw new IllegalArgumentException("shutdownTimeout must be positive, got: " + shutdownTimeout);
        }
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    /**
     * Gets how long {@code shutdown()} waits for the worker to exit.
     *
     * @return The shutdown timeout
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Creates a copy of this configuration, so a dispatcher is unaffected by
     * later changes to the instance it was built from.
     *
     * @return a new CallbackConfig with the same values
     */
    public CallbackConfig copy() {
        return new CallbackConfig()
                .setName(name)
                .setDaemon(daemon)
                .setShutdownTimeout(shutdownTimeout);
    }

    @Override
    public String toString() {
        return "CallbackConfig{" +
                "name='" + name + '\'' +
                ", daemon=" + daemon +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }
}
