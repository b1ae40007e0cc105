package io.barsync.marketdata.validate;

public enum Verdict {
    PASS, WARN, FAIL;

    /** PASS and WARN batches may be stored. */
    public boolean storable() { return this != FAIL; }
}
