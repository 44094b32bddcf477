package com.conduitsystems.handler;

import ch.qos.logback.classic.Level;
import com.conduitsystems.ThreadedCallback;
import com.conduitsystems.config.CallbackConfig;
import com.conduitsystems.helper.LogEvents;
import com.conduitsystems.helper.RecordingCallback;
import com.conduitsystems.mailbox.PendingInvocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for failure handler routing from the dispatch loop.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class CallbackFailureHandlerTest {

    @Test
    @SuppressWarnings("unchecked")
    void testHandlerReceivesInvocationAndError() {
        CallbackFailureHandler<String> handler = mock(CallbackFailureHandler.class);
        IllegalStateException failure = new IllegalStateException("rejected");
        ThreadedCallback<String> callback = new ThreadedCallback<>(payload -> {
            throw failure;
        }, new CallbackConfig(), handler);

        try {
            callback.call("payload");

            ArgumentCaptor<PendingInvocation<String>> invocation = ArgumentCaptor.forClass(PendingInvocation.class);
            verify(handler, timeout(1000)).onFailure(invocation.capture(), same(failure));
            assertEquals("payload", invocation.getValue().payload());
            assertEquals(1, invocation.getValue().sequence());
        } finally {
            callback.shutdown();
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFailingHandlerDoesNotStopDelivery() throws InterruptedException {
        CallbackFailureHandler<Integer> handler = mock(CallbackFailureHandler.class);
        doThrow(new RuntimeException("handler broke")).when(handler).onFailure(any(), any());
        RecordingCallback<Integer> recorder = new RecordingCallback<>();

        try (LogEvents logs = LogEvents.capture(ThreadedCallback.class)) {
            ThreadedCallback<Integer> callback = new ThreadedCallback<>(payload -> {
                if (payload == 0) {
                    throw new ArithmeticException("zero");
                }
                recorder.call(payload);
            }, new CallbackConfig(), handler);

            try {
                callback.call(0);
                callback.call(1);

                assertTrue(recorder.awaitSize(1, 1, TimeUnit.SECONDS));
                assertEquals(List.of(1), recorder.delivered());
                assertTrue(logs.awaitContains(Level.ERROR, "failure handler failed", 1, TimeUnit.SECONDS));
            } finally {
                callback.shutdown();
            }
        }
    }

    @Test
    void testIgnoreHandlerDoesNothing() {
        CallbackFailureHandler<String> handler = CallbackFailureHandler.ignore();
        assertDoesNotThrow(() -> handler.onFailure(
                new PendingInvocation<>(1, "x", System.nanoTime()), new RuntimeException()));
    }
}
