package com.conduitsystems.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CallbackConfig defaults and validation.
 */
class CallbackConfigTest {

    @Test
    void testDefaults() {
        CallbackConfig config = new CallbackConfig();

        assertEquals("callback", config.getName());
        assertTrue(config.isDaemon());
        assertEquals(Duration.ofSeconds(5), config.getShutdownTimeout());
    }

    @Test
    void testFluentSetters() {
        CallbackConfig config = new CallbackConfig()
                .setName("events")
                .setDaemon(false)
                .setShutdownTimeout(Duration.ofMillis(250));

        assertEquals("events", config.getName());
        assertFalse(config.isDaemon());
        assertEquals(Duration.ofMillis(250), config.getShutdownTimeout());
    }

    @Test
    void testRejectsInvalidValues() {
        CallbackConfig config = new CallbackConfig();

        assertThrows(NullPointerException.class, () -> config.setName(null));
        assertThrows(IllegalArgumentException.class, () -> config.setName("  "));
        assertThrows(NullPointerException.class, () -> config.setShutdownTimeout(null));
        assertThrows(IllegalArgumentException.class, () -> config.setShutdownTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.setShutdownTimeout(Duration.ofSeconds(-1)));
        assertEquals("callback", config.getName());
    }

    @Test
    void testCopyIsIndependent() {
        CallbackConfig original = new CallbackConfig().setName("original");
        CallbackConfig copy = original.copy();

        original.setName("changed").setDaemon(false);

        assertEquals("original", copy.getName());
        assertTrue(copy.isDaemon());
    }

    @Test
    void testToStringIncludesValues() {
        String text = new CallbackConfig().setName("events").toString();
        assertTrue(text.contains("events"));
        assertTrue(text.contains("PT5S"));
    }
}
