package io.barsync.marketdata.store;

import java.nio.file.Path;

/** Upgrading an older store file failed; the original file is left in place. */
public class StoreMigrationException extends StoreException {
    private final transient Path backup;

    public StoreMigrationException(String message) {
        this(message, null, null);
    }

    public StoreMigrationException(String message, Throwable cause, Path backup) {
        super(message, cause);
        this.backup = backup;
    }

    public Path backup() { return backup; }
}
