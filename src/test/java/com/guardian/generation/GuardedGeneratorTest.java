package com.guardian.generation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GuardedGeneratorTest {

    private GuardedGenerator generator;

    @AfterEach
    void tearDown() {
        if (generator != null) {
            generator.close();
        }
    }

    @Test
    void returnsBackendOutput() {
        generator = new GuardedGenerator(prompt -> "echo: " + prompt, Duration.ofSeconds(2), 1, Duration.ZERO, 1);
        assertEquals("echo: hi", generator.generate("hi"));
    }

    @Test
    void retriesAfterTransientFailure() {
        AtomicInteger calls = new AtomicInteger();
        generator = new GuardedGenerator(prompt -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return "second time lucky";
        }, Duration.ofSeconds(2), 3, Duration.ofMillis(10), 1);

        assertEquals("second time lucky", generator.generate("hi"));
        assertEquals(2, calls.get());
    }

    @Test
    void hangingBackend_raisesTimeoutAfterAllAttempts() {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch never = new CountDownLatch(1);
        generator = new GuardedGenerator(prompt -> {
            calls.incrementAndGet();
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        }, Duration.ofMillis(100), 2, Duration.ZERO, 2);

        long started = System.nanoTime();
        assertThrows(GenerationTimeoutException.class, () -> generator.generate("hi"));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
        assertEquals(2, calls.get());
    }

    @Test
    void socketTimeoutFromBackend_countsAsTimeout() {
        generator = new GuardedGenerator(prompt -> {
            throw new IllegalStateException("I/O error", new SocketTimeoutException("Read timed out"));
        }, Duration.ofSeconds(2), 1, Duration.ZERO, 1);

        assertThrows(GenerationTimeoutException.class, () -> generator.generate("hi"));
    }

    @Test
    void persistentFailure_raisesGenerationFailed() {
        AtomicInteger calls = new AtomicInteger();
        generator = new GuardedGenerator(prompt -> {
            calls.incrementAndGet();
            throw new IllegalStateException("model not found");
        }, Duration.ofSeconds(2), 3, Duration.ZERO, 1);

        GenerationFailedException ex = assertThrows(GenerationFailedException.class, () -> generator.generate("hi"));
        assertTrue(ex.getMessage().contains("model not found"));
        assertEquals(3, calls.get());
    }

    @Test
    void blankCompletion_isTreatedAsFailure() {
        generator = new GuardedGenerator(prompt -> "   ", Duration.ofSeconds(2), 2, Duration.ZERO, 1);
        assertThrows(GenerationFailedException.class, () -> generator.generate("hi"));
    }

    @Test
    void invalidSettings_areRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new GuardedGenerator(prompt -> "x", Duration.ZERO, 1, Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new GuardedGenerator(prompt -> "x", Duration.ofSeconds(1), 0, Duration.ZERO, 1));
    }
}
