package com.hydralog.backend.logging.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    private final RetryBackoff backoff = new RetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 5);

    @Test
    void doubles_then_caps() {
        assertEquals(Duration.ofSeconds(1), backoff.delayAfter(1));
        assertEquals(Duration.ofSeconds(2), backoff.delayAfter(2));
        assertEquals(Duration.ofSeconds(8), backoff.delayAfter(4));
        assertEquals(Duration.ofSeconds(16), backoff.delayAfter(5));
        assertEquals(Duration.ofSeconds(30), backoff.delayAfter(6));
        assertEquals(Duration.ofSeconds(30), backoff.delayAfter(60));
    }

    @Test
    void gives_up_at_max_attempts() {
        assertFalse(backoff.shouldGiveUp(4));
        assertTrue(backoff.shouldGiveUp(5));
    }
}
