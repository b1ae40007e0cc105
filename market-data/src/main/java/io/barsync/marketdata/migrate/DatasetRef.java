package io.barsync.marketdata.migrate;

import io.barsync.marketdata.model.SeriesKey;

import java.nio.file.Path;

/** One dataset inside one source store file; the unit of migration work. */
public record DatasetRef(Path storeFile, SeriesKey key, int rowCount, String checksum) {
    @Override
    public String toString() { return storeFile.getFileName() + key.path(); }
}
