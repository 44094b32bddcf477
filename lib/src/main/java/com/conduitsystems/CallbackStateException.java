package com.conduitsystems;

/**
 * Thrown when a lifecycle hook of a {@link ThreadedCallback} is invoked in a state
 * that does not allow it, such as resuming a dispatcher that was never paused.
 * This signals misuse of the fork hooks and is not meant to be caught.
 */
public class CallbackStateException extends IllegalStateException {

    /** The name of the dispatcher that rejected the call. */
    private final String callbackName;

    /** The state observed when the call was rejected. */
    private final CallbackState state;

    /**
     * Creates a new CallbackStateException.
     *
     * @param message the detail message
     * @param callbackName the name of the dispatcher
     * @param state the state observed when the call was rejected
     */
    public CallbackStateException(String message, String callbackName, CallbackState state) {
        super(message);
        this.callbackName = callbackName;
        this.state = state;
    }

    /**
     * Gets the name of the dispatcher that rejected the call.
     *
     * @return the dispatcher name
     */
    public String getCallbackName() {
        return callbackName;
    }

    /**
     * Gets the state observed when the call was rejected.
     *
     * @return the observed state
     */
    public CallbackState getState() {
        return state;
    }

    @Override
    public String toString() {
        return "CallbackStateException{" +
                "callbackName='" + callbackName + '\'' +
                ", state=" + state +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
