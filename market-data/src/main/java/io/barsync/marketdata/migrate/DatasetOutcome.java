package io.barsync.marketdata.migrate;

public record DatasetOutcome(DatasetRef dataset, Status status, long rowsRead, long rowsWritten,
                             long duplicatesSkipped, long rowErrors, String error) {

    public enum Status { MIGRATED, SKIPPED, FAILED }

    static DatasetOutcome skipped(DatasetRef ref) { return new DatasetOutcome(ref, Status.SKIPPED, 0, 0, 0, 0, null); }

    static DatasetOutcome failed(DatasetRef ref, long read, long written, String error) {
        return new DatasetOutcome(ref, Status.FAILED, read, written, 0, 0, error);
    }
}
