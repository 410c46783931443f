package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.config.DedupProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DedupGuardTest {

    private MutableClock clock;
    private DedupGuard dedupGuard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
        dedupGuard = new DedupGuard(clock, new DedupProperties());
    }

    @Test
    void testMarkIfAbsent_WhenFirstSeen_ReturnsTrue() {
        assertTrue(dedupGuard.markIfAbsent("MSG1"));
        assertTrue(dedupGuard.contains("MSG1"));
    }

    @Test
    void testMarkIfAbsent_WhenSeenWithinWindow_ReturnsFalse() {
        dedupGuard.markIfAbsent("MSG1");
        clock.advance(Duration.ofMinutes(29));

        assertFalse(dedupGuard.markIfAbsent("MSG1"));
    }

    @Test
    void testMarkIfAbsent_WhenOlderThanTtl_ReturnsTrueAgain() {
        dedupGuard.markIfAbsent("MSG1");
        clock.advance(Duration.ofMinutes(31));

        assertFalse(dedupGuard.contains("MSG1"));
        assertTrue(dedupGuard.markIfAbsent("MSG1"));
    }

    @Test
    void testRegister_MakesLaterMarkADuplicate() {
        dedupGuard.register("SENT1");

        assertFalse(dedupGuard.markIfAbsent("SENT1"));
    }

    @Test
    void testRegister_WhenIdEmpty_IsIgnored() {
        dedupGuard.register("");
        dedupGuard.register(null);

        assertFalse(dedupGuard.contains(""));
        clock.advance(Duration.ofHours(1));
        assertEquals(0, dedupGuard.purgeExpired());
    }

    @Test
    void testPurgeExpired_RemovesOnlyAgedEntries() {
        dedupGuard.markIfAbsent("OLD");
        clock.advance(Duration.ofMinutes(20));
        dedupGuard.markIfAbsent("NEW");
        clock.advance(Duration.ofMinutes(11));

        int removed = dedupGuard.purgeExpired();

        assertEquals(1, removed);
        assertFalse(dedupGuard.contains("OLD"));
        assertTrue(dedupGuard.contains("NEW"));
    }

    @Test
    void testMarkIfAbsent_ConcurrentCallers_ExactlyOneWins() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return dedupGuard.markIfAbsent("RACE");
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }
}
