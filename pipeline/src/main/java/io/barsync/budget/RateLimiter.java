package io.barsync.budget;

/**
 * Request budget shared by every caller of one upstream account.
 */
public interface RateLimiter {
    /** Blocks until a request may be issued. */
    void acquire() throws InterruptedException;

    /** Takes a permit only if one is available right now. */
    boolean tryAcquire();

    /** Returns a permit that was acquired but not used. */
    void release();

    static RateLimiter unlimited() {
        return new RateLimiter() {
            @Override public void acquire() {}
            @Override public boolean tryAcquire() { return true; }
            @Override public void release() {}
        };
    }
}
