package io.barsync.budget;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket with an initial burst of one second worth of permits. Callers that find the bucket empty
 * reserve a future token and sleep for exactly the time until it refills, so waiting is proportional
 * to the deficit and never busy.
 */
public class TokenBucketRateLimiter implements RateLimiter {
    private final double nanosPerPermit;
    private final double capacity;
    private final TimeSource time;
    private final ReentrantLock lock = new ReentrantLock(true);

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double permitsPerSecond, TimeSource time) {
        if (permitsPerSecond <= 0) throw new IllegalArgumentException("permitsPerSecond must be positive");
        this.time = Objects.requireNonNull(time, "time");
        this.nanosPerPermit = TimeUnit.SECONDS.toNanos(1) / permitsPerSecond;
        this.capacity = Math.max(1.0, Math.floor(permitsPerSecond));
        this.tokens = capacity;
        this.lastRefillNanos = time.nanoTime();
    }

    /**
     * Budget of {@code requestsPerMinute} less a safety margin, never below one request per minute.
     */
    public static TokenBucketRateLimiter perMinute(int requestsPerMinute, int safetyMargin, TimeSource time) {
        int effective = Math.max(1, requestsPerMinute - Math.max(0, safetyMargin));
        return new TokenBucketRateLimiter(effective / 60.0, time);
    }

    @Override
    public void acquire() throws InterruptedException {
        long waitNanos;
        lock.lock();
        try {
            refill();
            tokens -= 1.0;
            waitNanos = tokens >= 0 ? 0L : (long) Math.ceil(-tokens * nanosPerPermit);
        } finally {
            lock.unlock();
        }
        if (waitNanos == 0) return;
        try {
            time.sleepNanos(waitNanos);
        } catch (InterruptedException ie) {
            release();
            throw ie;
        }
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens < 1.0) return false;
            tokens -= 1.0;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release() {
        lock.lock();
        try {
            tokens = Math.min(capacity, tokens + 1.0);
        } finally {
            lock.unlock();
        }
    }

    public double permitsPerSecond() { return TimeUnit.SECONDS.toNanos(1) / nanosPerPermit; }

    /** Currently available permits, negative when callers hold reservations. */
    public double availablePermits() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = time.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) return;
        tokens = Math.min(capacity, tokens + elapsed / nanosPerPermit);
        lastRefillNanos = now;
    }
}
