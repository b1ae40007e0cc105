package io.barsync.budget;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic clock plus sleep, injectable so rate limiting and backoff can run against simulated time.
 */
public interface TimeSource {
    long nanoTime();

    void sleepNanos(long nanos) throws InterruptedException;

    default void sleepMillis(long millis) throws InterruptedException {
        sleepNanos(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    TimeSource SYSTEM = new TimeSource() {
        @Override public long nanoTime() { return System.nanoTime(); }
        @Override public void sleepNanos(long nanos) throws InterruptedException {
            if (nanos > 0) TimeUnit.NANOSECONDS.sleep(nanos);
        }
    };
}
