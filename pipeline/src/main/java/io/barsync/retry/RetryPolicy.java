package io.barsync.retry;

public interface RetryPolicy {
    /** Whether the failure may succeed when repeated at all. */
    default boolean isRetryable(Exception e) { return true; }

    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    static RetryPolicy none() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0L; }
        };
    }
}
