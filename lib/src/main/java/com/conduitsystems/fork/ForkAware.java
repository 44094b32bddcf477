package com.conduitsystems.fork;

/**
 * Hooks for components that own threads and must survive a process fork.
 * <p>
 * A fork copies the process memory but only the forking thread. The host
 * integration layer calls {@link #pauseBeforeForkInParent()} before forking,
 * then {@link #resumeAfterForkInParent()} in the parent and
 * {@link #reopenAfterFork()} in the child. Nothing here intercepts the fork itself.
 */
public interface ForkAware {

    /**
     * Stops background threads, keeping pending work, and blocks until they have exited.
     */
    void pauseBeforeForkInParent();

    /**
     * Restarts background threads stopped by {@link #pauseBeforeForkInParent()}.
     *
     * @throws IllegalStateException if the component was not paused
     */
    void resumeAfterForkInParent();

    /**
     * Recreates background threads missing after a fork. Idempotent.
     */
    void reopenAfterFork();
}
