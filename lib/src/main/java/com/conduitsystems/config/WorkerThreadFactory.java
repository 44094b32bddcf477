package com.conduitsystems.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the platform threads that run dispatcher workers.
 * Threads are named {@code <name>-dispatch-<n>} for identification in logs and profilers,
 * and log anything that escapes the worker loop through SLF4J.
 */
public class WorkerThreadFactory implements ThreadFactory {
    private static final Logger logger = LoggerFactory.getLogger(WorkerThreadFactory.class);

    private final String prefix;
    private final boolean daemon;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    /**
     * Creates a thread factory for the given dispatcher configuration.
     *
     * @param config The dispatcher configuration
     */
    public WorkerThreadFactory(CallbackConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.prefix = config.getName() + "-dispatch";
        this.daemon = config.isDaemon();
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.error("Dispatch thread {} terminated by unrecoverable error", t.getName(), e));
        return thread;
    }

    /**
     * Gets the number of threads created so far.
     *
     * @return The thread count
     */
    public int getCreatedCount() {
        return threadNumber.get() - 1;
    }
}
