package com.clapgrow.tracking.api.counter;

import com.clapgrow.tracking.api.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWindowedCounterStoreTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryWindowedCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryWindowedCounterStore(clock);
    }

    @Test
    void acquireOnceSucceedsOncePerWindow() {
        assertTrue(store.acquireOnce("open:M1", WINDOW));
        assertFalse(store.acquireOnce("open:M1", WINDOW));
        assertTrue(store.acquireOnce("open:M2", WINDOW));

        clock.advance(Duration.ofSeconds(59));
        assertFalse(store.acquireOnce("open:M1", WINDOW));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.acquireOnce("open:M1", WINDOW));
    }

    @Test
    void incrementCountsWithinWindowAndResetsAfter() {
        assertEquals(1, store.incrementInWindow("rate:10.0.0.0", WINDOW));
        assertEquals(2, store.incrementInWindow("rate:10.0.0.0", WINDOW));

        clock.advance(Duration.ofSeconds(30));
        assertEquals(3, store.incrementInWindow("rate:10.0.0.0", WINDOW));

        // Window is anchored at the first increment, not extended by later ones
        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, store.incrementInWindow("rate:10.0.0.0", WINDOW));
    }

    @Test
    void evictionDropsOnlyExpiredWindows() {
        store.acquireOnce("a", Duration.ofSeconds(10));
        store.acquireOnce("b", Duration.ofSeconds(100));

        clock.advance(Duration.ofSeconds(20));
        store.evictExpired();

        assertEquals(1, store.size());
        assertFalse(store.acquireOnce("b", Duration.ofSeconds(100)));
    }

    @Test
    void concurrentClaimsHaveOneWinner() throws InterruptedException {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                executor.execute(() -> {
                    try {
                        start.await();
                        if (store.acquireOnce("open:race", WINDOW)) {
                            winners.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, winners.get());
    }
}
