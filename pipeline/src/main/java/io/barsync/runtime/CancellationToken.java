package io.barsync.runtime;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag checked by the runtime at record boundaries. A child token is cancelled
 * whenever its parent is, but cancelling the child leaves the parent untouched.
 */
public final class CancellationToken {
    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<String> reason = new AtomicReference<>();

    public CancellationToken() { this(null); }

    private CancellationToken(CancellationToken parent) { this.parent = parent; }

    public CancellationToken child() { return new CancellationToken(this); }

    public void cancel() { cancel("cancelled"); }

    public void cancel(String why) {
        if (cancelled.compareAndSet(false, true)) reason.set(why);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public String reason() {
        if (cancelled.get()) return reason.get();
        return parent == null ? null : parent.reason();
    }
}
