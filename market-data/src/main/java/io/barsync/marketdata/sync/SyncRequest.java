package io.barsync.marketdata.sync;

import io.barsync.marketdata.model.SeriesKey;

import java.time.LocalDate;

/** Bring {@code key} up to date for the dates {@code from..to} inclusive. */
public record SyncRequest(SeriesKey key, LocalDate from, LocalDate to) {}
