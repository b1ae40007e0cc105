package io.barsync.marketdata.model;

public enum OutcomeStatus {
    SUCCEEDED, PARTIAL, FAILED;

    /** Status of a unit made of {@code done} successful parts out of {@code total}. */
    public static OutcomeStatus of(long done, long total) {
        if (done >= total) return SUCCEEDED;
        return done == 0 ? FAILED : PARTIAL;
    }
}
