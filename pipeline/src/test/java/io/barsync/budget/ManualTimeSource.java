package io.barsync.budget;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Simulated time: sleeping advances the clock instead of blocking. Records every sleep so callers
 * can assert on waits.
 */
public class ManualTimeSource implements TimeSource {
    private long now;
    private final List<Long> sleeps = new ArrayList<>();

    public ManualTimeSource() { this(0L); }
    public ManualTimeSource(long startNanos) { this.now = startNanos; }

    @Override
    public synchronized long nanoTime() { return now; }

    @Override
    public synchronized void sleepNanos(long nanos) throws InterruptedException {
        if (Thread.interrupted()) throw new InterruptedException();
        if (nanos <= 0) return;
        sleeps.add(nanos);
        now += nanos;
    }

    public synchronized void advance(long amount, TimeUnit unit) { now += unit.toNanos(amount); }

    public synchronized List<Long> sleeps() { return List.copyOf(sleeps); }

    public synchronized long totalSleptNanos() {
        long total = 0;
        for (long s : sleeps) total += s;
        return total;
    }
}
