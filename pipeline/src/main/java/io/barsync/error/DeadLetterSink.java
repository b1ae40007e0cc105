package io.barsync.error;

import io.barsync.core.Record;

/** Receives records that could not be processed, with the stage that rejected them. */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);

    @Override default void close() {}
}
