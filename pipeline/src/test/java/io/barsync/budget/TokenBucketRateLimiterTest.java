package io.barsync.budget;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class TokenBucketRateLimiterTest {

    @Test
    void waits_for_exactly_the_deficit_once_the_burst_is_spent() throws Exception {
        ManualTimeSource time = new ManualTimeSource();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, time);
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        assertEquals(List.of(1_000_000_000L, 1_000_000_000L), time.sleeps());
    }

    @Test
    void per_minute_budget_subtracts_safety_margin() {
        TokenBucketRateLimiter limiter = TokenBucketRateLimiter.perMinute(180, 30, new ManualTimeSource());
        assertEquals(2.5, limiter.permitsPerSecond(), 1e-9);
    }

    @Test
    void never_exceeds_rate_over_a_window() throws Exception {
        ManualTimeSource time = new ManualTimeSource();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(3.0, time);
        for (int i = 0; i < 30; i++) limiter.acquire();
        // 3 burst permits, then 27 more at 3/s
        assertEquals(TimeUnit.SECONDS.toNanos(9), time.totalSleptNanos(), 1_000);
    }

    @Test
    void try_acquire_does_not_wait_and_refills_over_time() {
        ManualTimeSource time = new ManualTimeSource();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2.0, time);
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        time.advance(500, TimeUnit.MILLISECONDS);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertTrue(time.sleeps().isEmpty());
    }

    @Test
    void released_permit_is_reusable_without_waiting() throws Exception {
        ManualTimeSource time = new ManualTimeSource();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, time);
        limiter.acquire();
        limiter.release();
        limiter.acquire();
        assertTrue(time.sleeps().isEmpty());
        assertEquals(0.0, limiter.availablePermits(), 1e-9);
    }

    @Test
    void interrupted_waiter_returns_its_reservation() {
        ManualTimeSource time = new ManualTimeSource();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, time);
        assertTrue(limiter.tryAcquire());
        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class, limiter::acquire);
        assertFalse(Thread.interrupted());
        assertEquals(0.0, limiter.availablePermits(), 1e-9);
    }
}
