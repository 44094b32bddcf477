package com.conduitsystems.internal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Ownership of one dispatcher worker thread.
 * A dispatcher holds at most one handle at a time and never shares it.
 */
public final class WorkerHandle {

    private final Thread thread;

    private WorkerHandle(Thread thread) {
        this.thread = thread;
    }

    /**
     * Starts the given, not yet started thread and wraps it.
     *
     * @param thread an unstarted worker thread
     * @return a handle to the running worker
     */
    public static WorkerHandle start(Thread thread) {
        Objects.requireNonNull(thread, "thread cannot be null");
        thread.start();
        return new WorkerHandle(thread);
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    /**
     * Returns true if the caller is running on this worker.
     *
     * @return true when called from the worker thread itself
     */
    public boolean isCurrentThread() {
        return Thread.currentThread() == thread;
    }

    public String getName() {
        return thread.getName();
    }

    /**
     * Waits up to {@code timeout} for the worker to end. Timeouts beyond the
     * millisecond range of a {@code long} wait as long as that range allows.
     *
     * @param timeout the maximum time to wait
     * @return true if the worker ended within the timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean join(Duration timeout) throws InterruptedException {
        long millis = Math.max(1, TimeUnit.MILLISECONDS.convert(timeout));
        thread.join(millis);
        return !thread.isAlive();
    }

    /**
     * Waits for the worker to end, without a bound and without giving up on interrupt.
     * An interrupt received while waiting is re-asserted on the caller once the worker has ended.
     */
    public void joinUninterruptibly() {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    thread.join();
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String toString() {
        return "WorkerHandle{" + thread.getName() + ", alive=" + thread.isAlive() + '}';
    }
}
