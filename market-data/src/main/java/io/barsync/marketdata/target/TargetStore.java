package io.barsync.marketdata.target;

import io.barsync.marketdata.model.SeriesKey;

/**
 * Secondary, query-oriented store that migrated bars are drained into.
 */
public interface TargetStore extends AutoCloseable {
    /** Creates the per-segment tables with deduplication on (ts, exchange, symbol, interval). */
    void ensureSchema() throws TargetStoreException;

    TargetWriter openWriter() throws TargetStoreException;

    long countRows(SeriesKey key) throws TargetStoreException;

    @Override
    default void close() throws TargetStoreException {}
}
