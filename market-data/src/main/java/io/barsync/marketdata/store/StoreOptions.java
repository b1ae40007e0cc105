package io.barsync.marketdata.store;

import java.nio.file.Path;
import java.time.Clock;

/**
 * @param backupDir     where backups are written before upgrades and on request
 * @param maxBackups    backups retained per store file
 * @param verifyOnOpen  decompress and checksum every dataset when a store is opened
 */
public record StoreOptions(Path backupDir, int maxBackups, boolean verifyOnOpen, Clock clock, StoreMigrations migrations) {

    public static StoreOptions defaults(Path dataDir) {
        return new StoreOptions(dataDir.resolve("backups"), 3, true, Clock.systemUTC(), StoreMigrations.standard());
    }

    public StoreOptions withClock(Clock c) { return new StoreOptions(backupDir, maxBackups, verifyOnOpen, c, migrations); }

    public StoreOptions withMigrations(StoreMigrations m) { return new StoreOptions(backupDir, maxBackups, verifyOnOpen, clock, m); }
}
