package com.conduitsystems.fork;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Drives the fork hooks of every registered {@link ForkAware} participant.
 * <p>
 * Participants are paused and reopened in registration order and resumed in reverse
 * order. A failing participant does not stop the others; once all have run, the
 * first failure is rethrown wrapped in a {@link ForkHookException}.
 * <p>
 * Usage:
 * <pre>{@code
 * ForkHookRegistry hooks = new ForkHookRegistry();
 * hooks.register(eventCallback);
 * hooks.register(watchCallback);
 *
 * hooks.beforeFork();
 * long pid = forkProcess();
 * if (pid == 0) {
 *     hooks.afterForkInChild();
 * } else {
 *     hooks.afterForkInParent();
 * }
 * }</pre>
 */
public class ForkHookRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ForkHookRegistry.class);

    private final CopyOnWriteArrayList<ForkAware> participants = new CopyOnWriteArrayList<>();

    /**
     * Registers a participant. Registering the same instance twice has no effect.
     *
     * @param participant the participant to register
     * @return true if the participant was added
     */
    public boolean register(ForkAware participant) {
        Objects.requireNonNull(participant, "participant cannot be null");
        return participants.addIfAbsent(participant);
    }

    /**
     * Removes a participant.
     *
     * @param participant the participant to remove
     * @return true if the participant was registered
     */
    public boolean unregister(ForkAware participant) {
        return participants.remove(participant);
    }

    public int size() {
        return participants.size();
    }

    /**
     * Pauses every participant, in registration order. Call in the parent before forking.
     */
    public void beforeFork() {
        run("beforeFork", participants, ForkAware::pauseBeforeForkInParent);
    }

    /**
     * Resumes every participant, in reverse registration order. Call in the parent after forking.
     */
    public void afterForkInParent() {
        List<ForkAware> reversed = new ArrayList<>(participants);
        Collections.reverse(reversed);
        run("afterForkInParent", reversed, ForkAware::resumeAfterForkInParent);
    }

    /**
     * Reopens every participant, in registration order. Call in the child after forking.
     */
    public void afterForkInChild() {
        run("afterForkInChild", participants, ForkAware::reopenAfterFork);
    }

    private void run(String hook, List<ForkAware> targets, Consumer<ForkAware> action) {
        logger.debug("Running {} on {} participant(s)", hook, targets.size());
        RuntimeException first = null;
        int failures = 0;
        for (ForkAware participant : targets) {
            try {
                action.accept(participant);
            } catch (RuntimeException e) {
                logger.error("Fork participant {} failed in {}", participant, hook, e);
                failures++;
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw new ForkHookException(hook, failures, first);
        }
    }
}
