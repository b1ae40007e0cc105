package io.barsync.marketdata.store;

import io.barsync.marketdata.model.SeriesKey;

/**
 * Stored bytes or metadata contradict themselves: checksum mismatch, undecodable block, overlapping coverage.
 * Halts work on the affected dataset; it is never repaired automatically.
 */
public class StorageIntegrityException extends StoreException {
    private final transient SeriesKey key;

    public StorageIntegrityException(SeriesKey key, String message) {
        this(key, message, null);
    }

    public StorageIntegrityException(SeriesKey key, String message, Throwable cause) {
        super(key == null ? message : key + ": " + message, cause);
        this.key = key;
    }

    /** Affected dataset, null when the whole file is affected. */
    public SeriesKey key() { return key; }
}
