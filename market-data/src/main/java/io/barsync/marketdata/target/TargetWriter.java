package io.barsync.marketdata.target;

import java.util.List;

/** A single-owner write session against the secondary store. Never shared between workers. */
public interface TargetWriter extends AutoCloseable {
    /** Writes a batch; rows whose dedup key already exists replace the stored row. Returns the rows sent. */
    int write(List<MigrationRecord> batch) throws TargetStoreException;

    void flush() throws TargetStoreException;

    @Override
    void close() throws TargetStoreException;
}
