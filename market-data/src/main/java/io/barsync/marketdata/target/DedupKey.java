package io.barsync.marketdata.target;

/** Identity of a row in the secondary store; a second write with the same key replaces the first. */
public record DedupKey(long timestamp, String exchange, String symbol, String interval) {}
