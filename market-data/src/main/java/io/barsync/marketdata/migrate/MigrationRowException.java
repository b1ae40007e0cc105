package io.barsync.marketdata.migrate;

/** A stored row that cannot be turned into a target row; it is dead-lettered and skipped. */
public class MigrationRowException extends Exception {
    public MigrationRowException(String message) { super(message); }
}
