package io.barsync.marketdata.store;

public enum WriteMode {
    /** Adds bars for a range that must not overlap existing coverage. */
    APPEND,
    /** Replaces the dataset and its coverage. */
    OVERWRITE
}
