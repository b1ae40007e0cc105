package io.barsync.marketdata.store;

import java.nio.file.Path;

/** Store file written by a newer release. */
public class StoreVersionException extends StoreException {
    private final int found;
    private final int supported;

    public StoreVersionException(Path file, int found, int supported) {
        super((file == null ? "store file" : file.toString()) + " has store version " + found + " but this release supports up to " + supported);
        this.found = found;
        this.supported = supported;
    }

    public int found() { return found; }
    public int supported() { return supported; }
}
