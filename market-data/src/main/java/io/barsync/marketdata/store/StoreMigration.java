package io.barsync.marketdata.store;

import java.io.IOException;

/**
 * One upgrade step between adjacent store versions. Steps are pure functions of the file image so a
 * failure never touches the original file.
 */
public interface StoreMigration {
    int fromVersion();

    int toVersion();

    byte[] apply(byte[] image) throws IOException;
}
