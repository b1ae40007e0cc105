package io.barsync.marketdata.store;

import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SeriesKey;

import java.nio.file.Path;
import java.util.Set;

public record StoreStats(Path file, MarketSegment segment, int version, int datasets, long rows, long fileBytes,
                         Set<SeriesKey> quarantined) {
}
