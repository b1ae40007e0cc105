package io.barsync.marketdata.fetch;

import io.barsync.marketdata.validate.ValidationReport;

/**
 * What happened to one chunk. FETCHED and NO_TRADING_DAYS are hand-off states between fetch and commit;
 * every other status is final.
 */
public record ChunkOutcome(Chunk chunk, Status status, ValidationReport validation, int attempts, int rowsCommitted, String error) {

    public enum Status {
        FETCHED,
        NO_TRADING_DAYS,
        COMMITTED,
        VALIDATION_FAILED,
        TRANSIENT_EXHAUSTED,
        PERMANENT_FAILURE,
        STORAGE_FAILED,
        HALTED,
        CANCELLED,
        ERROR
    }

    static ChunkOutcome of(Chunk chunk, Status status, int attempts, String error) {
        return new ChunkOutcome(chunk, status, null, attempts, 0, error);
    }

    ChunkOutcome with(Status s, String why) { return new ChunkOutcome(chunk, s, validation, attempts, 0, why); }

    ChunkOutcome committed(int rows) { return new ChunkOutcome(chunk, Status.COMMITTED, validation, attempts, rows, null); }

    public boolean isCommitted() { return status == Status.COMMITTED; }
}
