package com.conduitsystems;

import com.conduitsystems.builder.ThreadedCallbackBuilder;
import com.conduitsystems.config.CallbackConfig;
import com.conduitsystems.config.WorkerThreadFactory;
import com.conduitsystems.fork.ForkAware;
import com.conduitsystems.handler.CallbackFailureHandler;
import com.conduitsystems.internal.WorkerHandle;
import com.conduitsystems.mailbox.PendingInvocation;
import com.conduitsystems.mailbox.PendingInvocations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers payloads to a {@link Callback} on a single dedicated worker thread.
 * <p>
 * {@link #call(Object)} appends to an unbounded queue and returns at once, so the
 * producing thread never waits for the callback. The worker delivers payloads one at a
 * time in enqueue order. A callback failure is logged and the worker moves on to the
 * next payload; producers never see it.
 * <p>
 * State, queue and worker handle are guarded by one lock. The worker waits on its
 * condition until the queue is non-empty or the state leaves {@link CallbackState#RUNNING}.
 * When woken by a state change the worker returns without taking anything from the queue:
 * after a pause the next worker delivers the backlog, after shutdown it is never delivered.
 * <p>
 * Usage:
 * <pre>{@code
 * ThreadedCallback<WatchEvent> events = new ThreadedCallback<>(event -> listener.process(event));
 * events.call(event);              // returns immediately
 *
 * events.pauseBeforeForkInParent();
 * // fork
 * events.resumeAfterForkInParent(); // parent
 * events.reopenAfterFork();         // child
 *
 * events.shutdown(Duration.ofSeconds(1));
 * }</pre>
 *
 * @param <T> The type of payload delivered to the callback
 */
public class ThreadedCallback<T> implements ForkAware, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ThreadedCallback.class);

    private final String name;
    private final Callback<T> callback;
    private final CallbackFailureHandler<T> failureHandler;
    private final Duration shutdownTimeout;
    private final WorkerThreadFactory threadFactory;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();

    // guarded by lock
    private final PendingInvocations<T> queue = new PendingInvocations<>();
    private CallbackState state = CallbackState.RUNNING;

    // written under lock; volatile for the unlocked liveness checks
    private volatile WorkerHandle worker;

    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicInteger workersStarted = new AtomicInteger();
    private final AtomicInteger liveWorkers = new AtomicInteger();

    /**
     * Creates a dispatcher with default configuration and starts its worker.
     *
     * @param callback The callback to deliver payloads to
     */
    public ThreadedCallback(Callback<T> callback) {
        this(callback, new CallbackConfig());
    }

    /**
     * Creates a dispatcher and starts its worker.
     *
     * @param callback The callback to deliver payloads to
     * @param config   The dispatcher configuration
     */
    public ThreadedCallback(Callback<T> callback, CallbackConfig config) {
        this(callback, config, CallbackFailureHandler.ignore());
    }

    /**
     * Creates a dispatcher and starts its worker.
     *
     * @param callback       The callback to deliver payloads to
     * @param config         The dispatcher configuration
     * @param failureHandler Receives invocations whose callback threw, after they are logged
     */
    public ThreadedCallback(Callback<T> callback, CallbackConfig config, CallbackFailureHandler<T> failureHandler) {
        this.callback = Objects.requireNonNull(callback, "callback cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler cannot be null");
        this.name = config.getName();
        this.shutdownTimeout = config.getShutdownTimeout();
        this.threadFactory = new WorkerThreadFactory(config);

        lock.lock();
        try {
            spawnWorker();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts a fluent builder for a dispatcher.
     *
     * @param callback The callback to deliver payloads to
     * @param <T>      The type of payload
     * @return a new builder
     */
    public static <T> ThreadedCallbackBuilder<T> builder(Callback<T> callback) {
        return new ThreadedCallbackBuilder<>(callback);
    }

    /**
     * Enqueues a payload for delivery and returns immediately.
     * <p>
     * Never blocks on the callback and never reports its outcome. After
     * {@link #shutdown()} the payload is accepted but will never be delivered.
     *
     * @param payload the payload to deliver
     */
    public void call(T payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        lock.lock();
        try {
            PendingInvocation<T> invocation = queue.append(payload);
            if (state == CallbackState.SHUTDOWN) {
                logger.trace("ThreadedCallback {} is shut down, invocation #{} will not be delivered",
                        name, invocation.sequence());
            }
            workAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if the dispatcher is in {@link CallbackState#RUNNING}.
     *
     * @return true if running
     */
    public boolean isRunning() {
        lock.lock();
        try {
            return state == CallbackState.RUNNING;
        } finally {
            lock.unlock();
        }
    }

    public CallbackState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shuts down using the configured timeout (5 seconds unless configured otherwise).
     */
    public void shutdown() {
        shutdown(shutdownTimeout);
    }

    /**
     * Moves to {@link CallbackState#SHUTDOWN} and waits up to {@code timeout} for the worker to exit.
     * <p>
     * Idempotent. Pending invocations are abandoned. If the worker is still busy in the
     * callback when the timeout elapses, an error is logged and this method returns anyway;
     * the callback is never interrupted. A zero timeout signals the worker without waiting.
     *
     * @param timeout how long to wait for the worker
     * @throws IllegalArgumentException if the timeout is negative
     */
    public void shutdown(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative, got: " + timeout);
        }
        logger.debug("ThreadedCallback {} shutdown", name);

        WorkerHandle current;
        lock.lock();
        try {
            if (state == CallbackState.SHUTDOWN) {
                return;
            }
            state = CallbackState.SHUTDOWN;
            workAvailable.signalAll();
            current = worker;
            if (current == null) {
                return;
            }
            if (!queue.isEmpty()) {
                logger.debug("ThreadedCallback {} abandoning {} pending invocation(s)", name, queue.size());
            }
        } finally {
            lock.unlock();
        }

        // Shut down from inside the callback; the worker exits once the callback returns
        if (current.isCurrentThread()) {
            logger.debug("ThreadedCallback {} shutdown called from dispatch thread, not joining", name);
            return;
        }
        if (timeout.isZero()) {
            logger.debug("ThreadedCallback {} shutdown with zero timeout, not joining {}", name, current.getName());
            return;
        }

        try {
            if (!current.join(timeout)) {
                logger.error("ThreadedCallback {} timed out after {} waiting for dispatch thread {}, callback: {}",
                        name, timeout, current.getName(), callback);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for ThreadedCallback {} dispatch thread to exit", name);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    public void close() {
        shutdown();
    }

    /**
     * Stops the worker ahead of a fork, keeping the queue for {@link #resumeAfterForkInParent()}.
     * <p>
     * Returns at once, leaving the state unchanged, if no worker is alive or the dispatcher
     * is not running. Otherwise blocks, without a timeout and ignoring interrupts, until the
     * worker has finished its current callback and exited.
     *
     * @throws CallbackStateException if called from the dispatch thread itself
     */
    @Override
    public void pauseBeforeForkInParent() {
        WorkerHandle current = worker;
        if (current == null || !current.isAlive()) {
            logger.debug("ThreadedCallback {} pauseBeforeForkInParent: no live dispatch thread", name);
            return;
        }

        lock.lock();
        try {
            current = worker;
            if (state != CallbackState.RUNNING || current == null) {
                logger.debug("ThreadedCallback {} pauseBeforeForkInParent: state is {}, nothing to pause",
                        name, state);
                return;
            }
            if (current.isCurrentThread()) {
                throw new CallbackStateException(
                        "Cannot pause ThreadedCallback " + name + " from its own dispatch thread", name, state);
            }
            state = CallbackState.PAUSED;
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        logger.debug("ThreadedCallback {} joining dispatch thread {}", name, current.getName());
        current.joinUninterruptibly();

        lock.lock();
        try {
            if (worker == current) {
                worker = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restarts delivery after {@link #pauseBeforeForkInParent()}.
     * The new worker continues with the invocations queued before the pause.
     *
     * @throws CallbackStateException if the dispatcher is not paused or still holds a worker
     */
    @Override
    public void resumeAfterForkInParent() {
        lock.lock();
        try {
            if (state != CallbackState.PAUSED) {
                throw new CallbackStateException(
                        "ThreadedCallback " + name + " state was not PAUSED, state: " + state, name, state);
            }
            if (worker != null) {
                throw new CallbackStateException(
                        "ThreadedCallback " + name + " dispatch thread was not cleared: " + worker, name, state);
            }
            logger.debug("ThreadedCallback {} resuming with {} pending invocation(s)", name, queue.size());
            state = CallbackState.RUNNING;
            spawnWorker();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts a new worker if the dispatcher is running but has none alive,
     * as in a child process after a fork. Otherwise does nothing.
     */
    @Override
    public void reopenAfterFork() {
        logger.debug("ThreadedCallback {} reopenAfterFork", name);
        lock.lock();
        try {
            if (state != CallbackState.RUNNING) {
                logger.debug("ThreadedCallback {} reopenAfterFork: state was not RUNNING: {}", name, state);
                return;
            }
            WorkerHandle current = worker;
            if (current != null && current.isAlive()) {
                logger.debug("ThreadedCallback {} reopenAfterFork: dispatch thread {} still alive",
                        name, current.getName());
                return;
            }
            spawnWorker();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private void spawnWorker() {
        worker = WorkerHandle.start(threadFactory.newThread(this::dispatchLoop));
        workersStarted.incrementAndGet();
        logger.debug("ThreadedCallback {} started dispatch thread {}", name, worker.getName());
    }

    private void dispatchLoop() {
        liveWorkers.incrementAndGet();
        try {
            while (true) {
                PendingInvocation<T> invocation;

                lock.lock();
                try {
                    while (queue.isEmpty() && state == CallbackState.RUNNING) {
                        workAvailable.awaitUninterruptibly();
                    }

                    // A state change wins over the backlog
                    if (state != CallbackState.RUNNING) {
                        logger.debug("ThreadedCallback {} state is {}, returning with {} pending invocation(s)",
                                name, state, queue.size());
                        return;
                    }

                    invocation = queue.shift();
                } finally {
                    lock.unlock();
                }

                deliver(invocation);
            }
        } finally {
            liveWorkers.decrementAndGet();
            logger.debug("ThreadedCallback {} dispatch thread {} returning", name, Thread.currentThread().getName());
        }
    }

    private void deliver(PendingInvocation<T> invocation) {
        long startedNanos = System.nanoTime();
        try {
            callback.call(invocation.payload());
            deliveredCount.incrementAndGet();
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable e) {
            failedCount.incrementAndGet();
            logger.error("ThreadedCallback {} error delivering invocation #{} to callback {} after {} ms queued",
                    name, invocation.sequence(), callback,
                    TimeUnit.NANOSECONDS.toMillis(invocation.queuedNanos(startedNanos)), e);
            try {
                failureHandler.onFailure(invocation, e);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable handlerError) {
                logger.error("ThreadedCallback {} failure handler failed for invocation #{}",
                        name, invocation.sequence(), handlerError);
            }
        } finally {
            // An interrupt left by one callback must not fail the next one
            if (Thread.interrupted()) {
                logger.debug("ThreadedCallback {} cleared interrupt left by invocation #{}",
                        name, invocation.sequence());
            }
        }
    }

    public String getName() {
        return name;
    }

    public Callback<T> getCallback() {
        return callback;
    }

    /**
     * Gets the number of invocations waiting for delivery.
     *
     * @return the queue length
     */
    public int getPendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if a worker thread is currently alive. Advisory: the answer may be
     * stale by the time the caller acts on it.
     *
     * @return true if a worker is alive
     */
    public boolean isWorkerAlive() {
        WorkerHandle current = worker;
        return current != null && current.isAlive();
    }

    /**
     * Gets the number of invocations whose callback completed normally.
     *
     * @return the delivered count
     */
    public long getDeliveredCount() {
        return deliveredCount.get();
    }

    /**
     * Gets the number of invocations whose callback threw.
     *
     * @return the failed count
     */
    public long getFailedCount() {
        return failedCount.get();
    }

    /**
     * Gets the number of worker threads started over this dispatcher's lifetime.
     *
     * @return the started worker count
     */
    public int getWorkersStarted() {
        return workersStarted.get();
    }

    /**
     * Gets the number of workers currently inside the dispatch loop. Never more than one.
     *
     * @return the live worker count
     */
    public int getLiveWorkerCount() {
        return liveWorkers.get();
    }

    @Override
    public String toString() {
        return "ThreadedCallback{" +
                "name='" + name + '\'' +
                ", state=" + getState() +
                ", pending=" + getPendingCount() +
                ", worker=" + worker +
                '}';
    }
}
