package io.barsync.retry;

import io.barsync.budget.TimeSource;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Drives one unit of work through ATTEMPTING and WAITING until it reaches a terminal state.
 * Waits go through the {@link TimeSource} so tests can run the state machine against simulated time.
 */
public class Retrier {

    public enum State { ATTEMPTING, WAITING, SUCCEEDED, FAILED_PERMANENT, EXHAUSTED }

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }

    /** Observes failed attempts, e.g. to count retries. */
    @FunctionalInterface
    public interface Listener {
        void onFailure(int attempt, Exception error, State next);
    }

    public record Outcome<T>(State state, T value, Exception lastError, int attempts, long waitedMillis) {
        public boolean succeeded() { return state == State.SUCCEEDED; }
    }

    private final RetryPolicy policy;
    private final TimeSource time;
    private final Listener listener;

    public Retrier(RetryPolicy policy, TimeSource time) {
        this(policy, time, (attempt, error, next) -> {});
    }

    public Retrier(RetryPolicy policy, TimeSource time, Listener listener) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.time = Objects.requireNonNull(time, "time");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public <T> Outcome<T> run(Attempt<T> attempt) throws InterruptedException {
        State state = State.ATTEMPTING;
        int attempts = 0;
        long waited = 0;
        T value = null;
        Exception last = null;
        while (true) {
            switch (state) {
                case ATTEMPTING -> {
                    attempts++;
                    try {
                        value = attempt.call();
                        state = State.SUCCEEDED;
                    } catch (InterruptedException ie) {
                        throw ie;
                    } catch (Exception e) {
                        last = e;
                        if (!policy.isRetryable(e)) state = State.FAILED_PERMANENT;
                        else if (policy.shouldRetry(attempts, e)) state = State.WAITING;
                        else state = State.EXHAUSTED;
                        listener.onFailure(attempts, e, state);
                    }
                }
                case WAITING -> {
                    long backoff = policy.backoffMillis(attempts);
                    time.sleepNanos(TimeUnit.MILLISECONDS.toNanos(backoff));
                    waited += backoff;
                    state = State.ATTEMPTING;
                }
                case SUCCEEDED, FAILED_PERMANENT, EXHAUSTED -> {
                    return new Outcome<>(state, value, last, attempts, waited);
                }
            }
        }
    }
}
