package io.barsync.marketdata.migrate;

import java.nio.file.Path;

/** A source store file that could not be opened, so none of its datasets were migrated. */
public record SourceFailure(Path storeFile, String error) {
    @Override
    public String toString() { return storeFile.getFileName() + ": " + error; }
}
