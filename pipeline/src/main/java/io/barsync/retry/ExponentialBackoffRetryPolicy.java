package io.barsync.retry;

import java.util.Objects;
import java.util.function.Predicate;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final double multiplier;
    private final Predicate<Exception> retryable;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, 2.0, e -> true);
    }

    /**
     * @param multiplier growth factor per attempt, at least 1
     * @param retryable  classifies failures; non-retryable ones are never repeated
     */
    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis,
                                         double multiplier, Predicate<Exception> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.multiplier = Math.max(1.0, multiplier);
        this.retryable = Objects.requireNonNull(retryable, "retryable");
    }

    @Override
    public boolean isRetryable(Exception e) { return retryable.test(e); }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && isRetryable(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        double delay = baseMillis * Math.pow(multiplier, Math.min(30, Math.max(0, attempt - 1)));
        return (long) Math.min(delay, (double) maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
