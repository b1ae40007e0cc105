package io.barsync.core;

import java.util.List;

/**
 * Transform converts an input record into zero or more output records.
 * Implementations must preserve the input's seq in outputs while assigning subSeq deterministically.
 * A transform may hold per-worker resources; the runtime closes it when its worker exits.
 */
public interface Transform<I, O> extends AutoCloseable {
    List<Record<O>> apply(Record<I> input) throws Exception;

    @Override
    default void close() throws Exception {}
}
