package com.dataflywheel.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallTimeoutsTest {
    private final CallTimeouts callTimeouts = new CallTimeouts();

    @AfterEach
    void tearDown() {
        callTimeouts.close();
    }

    @Test
    void shouldReturnResultWithinTimeout() throws Exception {
        assertEquals("ok", callTimeouts.call(() -> "ok", Duration.ofSeconds(1)));
    }

    @Test
    void shouldInterruptCallThatExceedsTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(TimeoutException.class, () -> callTimeouts.call(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }, Duration.ofMillis(50)));

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldRethrowCallFailuresUnwrapped() {
        IOException io = assertThrows(IOException.class, () -> callTimeouts.call(() -> {
            throw new IOException("connection reset");
        }, Duration.ofSeconds(1)));
        assertEquals("connection reset", io.getMessage());

        assertThrows(IllegalStateException.class, () -> callTimeouts.call(() -> {
            throw new IllegalStateException("bad payload");
        }, Duration.ofSeconds(1)));
    }
}
