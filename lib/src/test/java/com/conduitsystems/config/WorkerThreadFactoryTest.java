package com.conduitsystems.config;

import ch.qos.logback.classic.Level;
import com.conduitsystems.helper.LogEvents;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkerThreadFactory naming, daemon flag and uncaught error logging.
 */
@Timeout(value = 10, unit = TimeUnit.SECONDS)
class WorkerThreadFactoryTest {

    @Test
    void testThreadsAreNamedAndNumbered() {
        WorkerThreadFactory factory = new WorkerThreadFactory(new CallbackConfig().setName("events"));

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("events-dispatch-1", first.getName());
        assertEquals("events-dispatch-2", second.getName());
        assertEquals(2, factory.getCreatedCount());
    }

    @Test
    void testDaemonFlagFollowsConfig() {
        Thread daemon = new WorkerThreadFactory(new CallbackConfig()).newThread(() -> { });
        Thread user = new WorkerThreadFactory(new CallbackConfig().setDaemon(false)).newThread(() -> { });

        assertTrue(daemon.isDaemon());
        assertFalse(user.isDaemon());
    }

    @Test
    void testUncaughtErrorIsLogged() throws InterruptedException {
        try (LogEvents logs = LogEvents.capture(WorkerThreadFactory.class)) {
            Thread thread = new WorkerThreadFactory(new CallbackConfig().setName("dying"))
                    .newThread(() -> {
                        throw new StackOverflowError("simulated");
                    });
            thread.start();
            thread.join(2000);

            assertTrue(logs.contains(Level.ERROR, "dying-dispatch-1"));
        }
    }
}
