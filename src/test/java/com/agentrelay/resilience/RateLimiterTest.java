package com.agentrelay.resilience;

import com.agentrelay.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock();
    private final RateLimiter limiter = new RateLimiter(Duration.ofSeconds(60), clock);

    @Test
    void allowsExactlyTheLimitThenRejects() {
        var start = clock.instant();
        assertEquals(2, limiter.allow("a", 3).remaining());
        assertEquals(1, limiter.allow("a", 3).remaining());
        assertEquals(0, limiter.allow("a", 3).remaining());

        var rejected = limiter.allow("a", 3);
        assertFalse(rejected.allowed());
        assertEquals(0, rejected.remaining());
        assertEquals(start.plusSeconds(60), rejected.resetAt());
    }

    @Test
    void rejectedCallsAreNotRecorded() {
        limiter.allow("a", 1);
        limiter.allow("a", 1);
        limiter.allow("a", 1);
        assertEquals(1, limiter.count("a"));
    }

    @Test
    void recoversOneSlotWhenOldestAgesOut() {
        limiter.allow("a", 3);
        clock.advance(Duration.ofSeconds(10));
        limiter.allow("a", 3);
        clock.advance(Duration.ofSeconds(10));
        limiter.allow("a", 3);
        assertFalse(limiter.allow("a", 3).allowed());

        clock.advance(Duration.ofSeconds(40));

        assertTrue(limiter.allow("a", 3).allowed());
        assertFalse(limiter.allow("a", 3).allowed());
    }

    @Test
    void keysAreIndependent() {
        limiter.allow("a", 1);
        assertTrue(limiter.allow("b", 1).allowed());
        assertFalse(limiter.allow("a", 1).allowed());
    }

    @Test
    void acquireThrowsWithResetTime() {
        limiter.acquire("a", 1);
        var ex = assertThrows(RateLimitExceededException.class, () -> limiter.acquire("a", 1));
        assertEquals("a", ex.key());
        assertEquals(0, ex.remaining());
        assertEquals(clock.instant().plusSeconds(60), ex.resetAt());
    }

    @Test
    void resetClearsWindow() {
        limiter.allow("a", 1);
        limiter.reset("a");
        assertEquals(0, limiter.count("a"));
        assertTrue(limiter.allow("a", 1).allowed());
        assertEquals(0, limiter.count("unknown"));
    }

    @Test
    void checkAndRecordIsAtomicUnderContention() throws Exception {
        var pool = Executors.newFixedThreadPool(8);
        var allowed = new AtomicInteger();
        var go = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 100; i++) {
                        if (limiter.allow("hot", 50).allowed()) allowed.incrementAndGet();
                    }
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(50, allowed.get());
        assertEquals(50, limiter.count("hot"));
    }
}
