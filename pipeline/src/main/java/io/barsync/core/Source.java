package io.barsync.core;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A Source produces records. Implementations should be non-blocking where possible and
 * assign seq values starting at zero without holes.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch next available record if any. Return empty when temporarily no data and
     * rely on {@link #isFinished()} to indicate completion for finite sources.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() {}

    /** Finite source over a fixed list, seq equal to list index. */
    static <T> Source<T> of(List<T> items) {
        List<T> copy = List.copyOf(items);
        return new Source<>() {
            private final Iterator<T> it = copy.iterator();
            private long seq = 0;

            @Override
            public synchronized Optional<Record<T>> poll() {
                if (!it.hasNext()) return Optional.empty();
                return Optional.of(Record.of(seq++, it.next()));
            }

            @Override
            public synchronized boolean isFinished() { return !it.hasNext(); }
        };
    }
}
