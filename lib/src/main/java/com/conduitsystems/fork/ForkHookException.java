package com.conduitsystems.fork;

/**
 * Thrown by {@link ForkHookRegistry} when one or more participants failed a fork hook.
 * The first failure is the cause; later ones are attached as suppressed exceptions.
 */
public class ForkHookException extends RuntimeException {

    /** The hook that failed, e.g. {@code afterForkInParent}. */
    private final String hook;

    /** The number of participants whose hook failed. */
    private final int failureCount;

    /**
     * Creates a new ForkHookException.
     *
     * @param hook the name of the hook that failed
     * @param failureCount the number of failing participants
     * @param cause the first failure
     */
    public ForkHookException(String hook, int failureCount, Throwable cause) {
        super(failureCount + " fork participant(s) failed in " + hook, cause);
        this.hook = hook;
        this.failureCount = failureCount;
    }

    public String getHook() {
        return hook;
    }

    public int getFailureCount() {
        return failureCount;
    }
}
